package org.broadinstitute.numtfinder.tools.numt.io;

import org.broadinstitute.numtfinder.tools.numt.CoverageProfile;
import org.broadinstitute.numtfinder.utils.Utils;
import org.broadinstitute.numtfinder.utils.tsv.DataLine;
import org.broadinstitute.numtfinder.utils.tsv.TableWriter;

import java.io.File;
import java.io.IOException;
import java.io.Writer;

public final class CoverageSummaryTableWriter extends TableWriter<CoverageProfile> {

    public CoverageSummaryTableWriter(final File file) throws IOException {
        super(file, NumtTableColumns.COVERAGE_COLUMNS);
    }

    public CoverageSummaryTableWriter(final Writer writer) throws IOException {
        super(writer, NumtTableColumns.COVERAGE_COLUMNS);
    }

    @Override
    protected void composeLine(final CoverageProfile profile, final DataLine dataLine) {
        dataLine.append(profile.getLocus())
                .append(profile.getLength())
                .append(profile.getCoveredBases())
                .append(Utils.formattedPercent(profile.getCoveredBases(), profile.getLength()))
                .append(Utils.formattedDouble(profile.getMeanDepth()))
                .append(Utils.formattedDouble(profile.getMedianDepth()))
                .append(profile.getMaxDepth());
    }
}
