package org.broadinstitute.numtfinder.tools.numt.io;

import org.broadinstitute.numtfinder.exceptions.UserException;
import org.broadinstitute.numtfinder.tools.numt.AlignmentHit;
import org.broadinstitute.numtfinder.utils.Utils;
import org.broadinstitute.numtfinder.utils.tsv.TableReader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Supported alignment hit table layouts.
 */
public enum HitTableFormat {
    /** Tab-separated table with a {@code SeqName Start End [Strand] BitScore Expect Length Identity mtStart mtEnd} header. */
    TABLE {
        @Override
        TableReader<AlignmentHit> open(final Path path) throws IOException {
            return new AlignmentHitTableReader(path);
        }
    },
    /** BLAST+ {@code -outfmt 6} output without header. */
    BLAST_TABULAR {
        @Override
        TableReader<AlignmentHit> open(final Path path) throws IOException {
            return new BlastTabularHitReader(path);
        }
    };

    abstract TableReader<AlignmentHit> open(final Path path) throws IOException;

    /**
     * Reads every hit of the table.
     *
     * @throws UserException.CouldNotReadInputFile if the file is missing, empty or unreadable
     * @throws UserException.BadInput if a line is malformed
     */
    public List<AlignmentHit> readHits(final Path path) {
        Utils.nonNull(path, "path");
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new UserException.CouldNotReadInputFile(path, "file does not exist or is not readable");
        }
        try {
            if (Files.size(path) == 0) {
                throw new UserException.CouldNotReadInputFile(path, "the hit table is empty");
            }
            try (final TableReader<AlignmentHit> reader = open(path)) {
                return reader.toList();
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        } catch (final UncheckedIOException e) {
            throw new UserException.CouldNotReadInputFile(path, e.getCause());
        }
    }
}
