package org.broadinstitute.numtfinder.tools.numt.io;

import org.broadinstitute.numtfinder.tools.numt.NumtFragment;
import org.broadinstitute.numtfinder.utils.tsv.DataLine;
import org.broadinstitute.numtfinder.utils.tsv.TableWriter;

import java.io.File;
import java.io.IOException;
import java.io.Writer;

/**
 * Writes the {@code numtfrag} table. {@code mtStart}/{@code mtEnd} are true reference coordinates and
 * {@code mtEnd < mtStart} marks a fragment spanning the reference origin.
 */
public final class NumtFragmentTableWriter extends TableWriter<NumtFragment> {

    public NumtFragmentTableWriter(final File file) throws IOException {
        super(file, NumtTableColumns.FRAGMENT_COLUMNS);
    }

    public NumtFragmentTableWriter(final Writer writer) throws IOException {
        super(writer, NumtTableColumns.FRAGMENT_COLUMNS);
    }

    @Override
    protected void composeLine(final NumtFragment fragment, final DataLine dataLine) {
        dataLine.append(fragment.getFragNum())
                .append(fragment.getContig())
                .append(fragment.getStart())
                .append(fragment.getEnd())
                .append(fragment.getStrand().getSymbol())
                .append(NumtTableColumns.formatScore(fragment.getBitScore()))
                .append(NumtTableColumns.formatScore(fragment.getExpect()))
                .append(fragment.getAlignedLength())
                .append(fragment.getIdentity())
                .append(fragment.getReference().getStart())
                .append(fragment.getReference().getEnd());
    }
}
