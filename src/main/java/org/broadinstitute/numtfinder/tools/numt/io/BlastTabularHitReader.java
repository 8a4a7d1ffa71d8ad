package org.broadinstitute.numtfinder.tools.numt.io;

import org.broadinstitute.numtfinder.tools.numt.AlignmentHit;
import org.broadinstitute.numtfinder.tools.numt.Strand;
import org.broadinstitute.numtfinder.utils.tsv.DataLine;
import org.broadinstitute.numtfinder.utils.tsv.TableColumnCollection;
import org.broadinstitute.numtfinder.utils.tsv.TableReader;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads BLAST+ tabular output ({@code -outfmt 6}) of the mitochondrial query searched against the assembly.
 * <p>
 * The query is the (doubled) mitochondrial reference and the subject the assembly sequence. The number of
 * identical bases is recovered as {@code round(pident * length / 100)}; {@code sstart > send} marks a
 * minus-strand hit.
 * </p>
 */
public final class BlastTabularHitReader extends TableReader<AlignmentHit> {

    public static final TableColumnCollection OUTFMT_6_COLUMNS = new TableColumnCollection(
            "qseqid", "sseqid", "pident", "length", "mismatch", "gapopen",
            "qstart", "qend", "sstart", "send", "evalue", "bitscore");

    public BlastTabularHitReader(final Path path) throws IOException {
        super(path.toString(), Files.newBufferedReader(path, StandardCharsets.UTF_8), OUTFMT_6_COLUMNS);
    }

    public BlastTabularHitReader(final String sourceName, final Reader reader) throws IOException {
        super(sourceName, reader, OUTFMT_6_COLUMNS);
    }

    @Override
    protected AlignmentHit createRecord(final DataLine dataLine) {
        final String sequenceName = dataLine.get("sseqid").trim();
        final int length = dataLine.getInt("length");
        final double percentIdentity = dataLine.getDouble("pident");
        if (percentIdentity < 0 || percentIdentity > 100) {
            throw dataLine.formatError("pident must be between 0 and 100 but was " + percentIdentity);
        }
        final int identity = (int) Math.round(percentIdentity * length / 100.0);
        final int start = dataLine.getInt("sstart");
        final int end = dataLine.getInt("send");
        final int qstart = dataLine.getInt("qstart");
        final int qend = dataLine.getInt("qend");
        return AlignmentHitTableReader.HitRecords.toHit(dataLine, sequenceName, start, end,
                start > end ? Strand.MINUS : Strand.PLUS,
                dataLine.getDouble("bitscore"), dataLine.getDouble("evalue"),
                length, identity, Math.min(qstart, qend), Math.max(qstart, qend));
    }
}
