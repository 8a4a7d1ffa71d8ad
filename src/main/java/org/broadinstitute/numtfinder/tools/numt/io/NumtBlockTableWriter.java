package org.broadinstitute.numtfinder.tools.numt.io;

import org.broadinstitute.numtfinder.tools.numt.NumtBlock;
import org.broadinstitute.numtfinder.utils.tsv.DataLine;
import org.broadinstitute.numtfinder.utils.tsv.TableWriter;

import java.io.File;
import java.io.IOException;
import java.io.Writer;

/**
 * Writes the {@code numtblock} table. {@code mtFrag} lists the member fragment numbers in merge order and
 * {@code FragNum} counts them.
 */
public final class NumtBlockTableWriter extends TableWriter<NumtBlock> {

    public NumtBlockTableWriter(final File file) throws IOException {
        super(file, NumtTableColumns.BLOCK_COLUMNS);
    }

    public NumtBlockTableWriter(final Writer writer) throws IOException {
        super(writer, NumtTableColumns.BLOCK_COLUMNS);
    }

    @Override
    protected void composeLine(final NumtBlock block, final DataLine dataLine) {
        dataLine.append(block.getContig())
                .append(block.getStart())
                .append(block.getEnd())
                .append(block.getStrand().getSymbol())
                .append(NumtTableColumns.formatScore(block.getBitScore()))
                .append(NumtTableColumns.formatScore(block.getExpect()))
                .append(block.getLength())
                .append(block.getIdentity())
                .append(block.getMtFrag())
                .append(block.getFragCount())
                .append(block.getFragLen())
                .append(block.getFragGaps());
    }
}
