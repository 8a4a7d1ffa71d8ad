package org.broadinstitute.numtfinder.utils.tsv;

import com.opencsv.CSVWriter;
import org.broadinstitute.numtfinder.utils.Utils;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Writes records of type {@code R} as a tab separated table.
 * <p>
 * Subclasses fill in one {@link DataLine} per record in {@link #composeLine}, usually as a chain of
 * {@link DataLine#append} calls in column order. The header goes out with the first record, or on
 * {@link #close()} for an empty table, so comments written before any record come first in the file.
 * </p>
 *
 * @param <R> the row record type.
 */
public abstract class TableWriter<R> implements Closeable {

    private final CSVWriter writer;

    private final TableColumnCollection columns;

    private boolean headerWritten = false;

    public TableWriter(final File file, final TableColumnCollection columns) throws IOException {
        this(newFileWriter(file), columns);
    }

    public TableWriter(final Writer writer, final TableColumnCollection columns) throws IOException {
        this.columns = Utils.nonNull(columns, "columns");
        this.writer = new CSVWriter(Utils.nonNull(writer, "writer"),
                TableUtils.COLUMN_SEPARATOR, TableUtils.QUOTE_CHARACTER, TableUtils.ESCAPE_CHARACTER);
    }

    private static BufferedWriter newFileWriter(final File file) throws IOException {
        return Files.newBufferedWriter(Utils.nonNull(file, "file").toPath(), StandardCharsets.UTF_8);
    }

    /**
     * Writes {@code comment} after the comment prefix on a line of its own.
     */
    public final void writeComment(final String comment) throws IOException {
        writer.writeNext(new String[]{TableUtils.COMMENT_PREFIX + Utils.nonNull(comment, "comment")}, false);
        checkError();
    }

    /**
     * @throws IllegalStateException if {@link #composeLine} leaves a column without a value.
     */
    public final void writeRecord(final R record) throws IOException {
        Utils.nonNull(record, "record");
        writeHeader();
        final DataLine dataLine = new DataLine(columns);
        composeLine(record, dataLine);
        writer.writeNext(dataLine.unpack(), false);
        checkError();
    }

    public final void writeAllRecords(final Iterable<R> records) throws IOException {
        for (final R record : Utils.nonNull(records, "records")) {
            writeRecord(record);
        }
    }

    @Override
    public final void close() throws IOException {
        writeHeader();
        writer.close();
    }

    private void writeHeader() throws IOException {
        if (!headerWritten) {
            writer.writeNext(columns.names().toArray(new String[0]), false);
            headerWritten = true;
            checkError();
        }
    }

    // CSVWriter keeps write failures to itself until asked
    private void checkError() throws IOException {
        if (writer.checkError()) {
            throw new IOException("failed to write a table line");
        }
    }

    /**
     * Fills {@code dataLine} with the values of {@code record}; neither is {@code null}.
     */
    protected abstract void composeLine(final R record, final DataLine dataLine);
}
