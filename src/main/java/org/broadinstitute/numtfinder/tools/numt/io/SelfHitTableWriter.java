package org.broadinstitute.numtfinder.tools.numt.io;

import org.broadinstitute.numtfinder.tools.numt.NumtBlock;
import org.broadinstitute.numtfinder.tools.numt.SelfHitCall;
import org.broadinstitute.numtfinder.utils.Utils;
import org.broadinstitute.numtfinder.utils.tsv.DataLine;
import org.broadinstitute.numtfinder.utils.tsv.TableWriter;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes the {@code selfhits} table: one row per assembly sequence called as a copy of the reference.
 */
public final class SelfHitTableWriter extends TableWriter<SelfHitCall> {

    public SelfHitTableWriter(final File file) throws IOException {
        super(file, NumtTableColumns.SELF_HIT_COLUMNS);
    }

    public SelfHitTableWriter(final Writer writer) throws IOException {
        super(writer, NumtTableColumns.SELF_HIT_COLUMNS);
    }

    @Override
    protected void composeLine(final SelfHitCall call, final DataLine dataLine) {
        dataLine.append(call.getSequenceName())
                .append(Utils.formattedDouble(call.getCoveragePercent()))
                .append(Utils.formattedDouble(call.getIdentityPercent()))
                .append(joinOrDash(call.getContributingFragNums()))
                .append(joinOrDash(call.getExtraFragNums()))
                .append(Boolean.toString(call.isExcluded()));
    }

    private static String joinOrDash(final List<Integer> fragNums) {
        return fragNums.isEmpty() ? NumtTableColumns.EMPTY_LIST
                : fragNums.stream().map(String::valueOf).collect(Collectors.joining(NumtBlock.FRAG_NUM_SEPARATOR));
    }
}
