package org.broadinstitute.numtfinder.tools.numt.io;

import org.broadinstitute.numtfinder.tools.numt.CoverageProfile;
import org.broadinstitute.numtfinder.utils.Utils;
import org.broadinstitute.numtfinder.utils.tsv.DataLine;
import org.broadinstitute.numtfinder.utils.tsv.TableWriter;

import java.io.File;
import java.io.IOException;
import java.io.Writer;

/**
 * Writes the {@code depthplot} table, one {@code Locus Pos X} row per reference position.
 */
public final class CoverageDepthTableWriter extends TableWriter<Integer> {

    private final CoverageProfile profile;

    public CoverageDepthTableWriter(final File file, final CoverageProfile profile) throws IOException {
        super(file, NumtTableColumns.DEPTH_COLUMNS);
        this.profile = Utils.nonNull(profile, "profile");
    }

    public CoverageDepthTableWriter(final Writer writer, final CoverageProfile profile) throws IOException {
        super(writer, NumtTableColumns.DEPTH_COLUMNS);
        this.profile = Utils.nonNull(profile, "profile");
    }

    public void writeProfile() throws IOException {
        for (int position = 1; position <= profile.getLength(); position++) {
            writeRecord(position);
        }
    }

    @Override
    protected void composeLine(final Integer position, final DataLine dataLine) {
        dataLine.append(profile.getLocus())
                .append(position)
                .append(profile.getDepth(position));
    }
}
