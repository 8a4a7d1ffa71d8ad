package org.broadinstitute.numtfinder.tools.numt.io;

import org.broadinstitute.numtfinder.tools.numt.AlignmentHit;
import org.broadinstitute.numtfinder.tools.numt.ReferenceInterval;
import org.broadinstitute.numtfinder.tools.numt.Strand;
import org.broadinstitute.numtfinder.utils.SimpleInterval;
import org.broadinstitute.numtfinder.utils.tsv.DataLine;
import org.broadinstitute.numtfinder.utils.tsv.TableColumnCollection;
import org.broadinstitute.numtfinder.utils.tsv.TableReader;
import org.broadinstitute.numtfinder.utils.tsv.TableUtils;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;

/**
 * Reads the tab-separated hit table with header
 * {@code SeqName Start End Strand BitScore Expect Length Identity mtStart mtEnd}.
 * <p>
 * The {@code Strand} column may be left out, in which case a {@code Start} greater than {@code End} marks a
 * minus-strand hit, as in the aligner's subject coordinates. Assembly coordinates are always stored ascending.
 * </p>
 */
public final class AlignmentHitTableReader extends TableReader<AlignmentHit> {

    private boolean hasStrandColumn;

    public AlignmentHitTableReader(final Path path) throws IOException {
        super(path);
    }

    public AlignmentHitTableReader(final String sourceName, final Reader reader) throws IOException {
        super(sourceName, reader, null);
    }

    @Override
    protected void processColumns(final TableColumnCollection columns) {
        TableUtils.checkMandatoryColumns(columns, NumtTableColumns.MANDATORY_HIT_COLUMNS, this::formatException);
        hasStrandColumn = columns.contains(NumtTableColumns.STRAND);
    }

    @Override
    protected AlignmentHit createRecord(final DataLine dataLine) {
        final String sequenceName = dataLine.get(NumtTableColumns.SEQ_NAME).trim();
        if (sequenceName.isEmpty()) {
            throw dataLine.formatError("empty " + NumtTableColumns.SEQ_NAME);
        }
        final int start = dataLine.getInt(NumtTableColumns.START);
        final int end = dataLine.getInt(NumtTableColumns.END);
        final Strand strand;
        if (hasStrandColumn) {
            try {
                strand = Strand.fromSymbol(dataLine.get(NumtTableColumns.STRAND));
            } catch (final IllegalArgumentException e) {
                throw dataLine.formatError(e.getMessage());
            }
        } else {
            strand = start > end ? Strand.MINUS : Strand.PLUS;
        }
        return HitRecords.toHit(dataLine, sequenceName, start, end, strand,
                dataLine.getDouble(NumtTableColumns.BIT_SCORE),
                dataLine.getDouble(NumtTableColumns.EXPECT),
                dataLine.getInt(NumtTableColumns.LENGTH),
                dataLine.getInt(NumtTableColumns.IDENTITY),
                dataLine.getInt(NumtTableColumns.MT_START),
                dataLine.getInt(NumtTableColumns.MT_END));
    }

    /**
     * Shared conversion of parsed hit fields into an {@link AlignmentHit}, reporting invalid values against the line.
     */
    static final class HitRecords {
        private HitRecords() {}

        static AlignmentHit toHit(final DataLine dataLine, final String sequenceName, final int start, final int end,
                                  final Strand strand, final double bitScore, final double expect, final int length,
                                  final int identity, final int mtStart, final int mtEnd) {
            if (start < 1 || end < 1 || mtStart < 1 || mtEnd < 1) {
                throw dataLine.formatError(String.format("coordinates must be positive: %d-%d on %s, %d-%d on the reference",
                        start, end, sequenceName, mtStart, mtEnd));
            }
            if (mtStart > mtEnd) {
                throw dataLine.formatError(String.format("reference start %d is after reference end %d", mtStart, mtEnd));
            }
            try {
                return new AlignmentHit(new SimpleInterval(sequenceName, Math.min(start, end), Math.max(start, end)),
                        strand, bitScore, expect, length, identity, ReferenceInterval.doubled(mtStart, mtEnd));
            } catch (final IllegalArgumentException e) {
                throw dataLine.formatError(e.getMessage());
            }
        }
    }
}
