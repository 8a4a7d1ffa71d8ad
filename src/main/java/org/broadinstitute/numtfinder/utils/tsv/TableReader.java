package org.broadinstitute.numtfinder.utils.tsv;

import com.google.common.collect.AbstractIterator;
import com.opencsv.CSVReader;
import org.broadinstitute.numtfinder.exceptions.UserException;
import org.broadinstitute.numtfinder.utils.Utils;

import java.io.Closeable;
import java.io.IOException;
import java.io.LineNumberReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Reads a tab separated table into records of type {@code R}.
 * <p>
 * Comment lines, blank lines and repeats of the header are skipped. The header is the first other line,
 * unless the subclass passes the columns of a headerless format to the constructor. Subclasses turn each
 * data line into a record in {@link #createRecord(DataLine)}, returning {@code null} to drop it.
 * </p>
 * <p>
 * Malformed content is reported as {@link UserException.BadInput} naming the source and the line.
 * </p>
 *
 * @param <R> record type.
 */
public abstract class TableReader<R> implements Closeable, Iterable<R> {

    private final String source;

    private final LineNumberReader lineReader;

    private final CSVReader csvReader;

    private final TableColumnCollection columns;

    private final Iterator<R> records;

    public TableReader(final Path path) throws IOException {
        this(Utils.nonNull(path, "path").toString(), Files.newBufferedReader(path, StandardCharsets.UTF_8), null);
    }

    /**
     * @param source name used in error messages, {@code null} for anonymous input.
     * @param fixedColumns the columns of an input without header line, otherwise {@code null}.
     */
    protected TableReader(final String source, final Reader reader, final TableColumnCollection fixedColumns) throws IOException {
        this.source = source;
        this.lineReader = new LineNumberReader(Utils.nonNull(reader, "reader"));
        this.csvReader = new CSVReader(lineReader, TableUtils.COLUMN_SEPARATOR, TableUtils.QUOTE_CHARACTER, TableUtils.ESCAPE_CHARACTER);
        this.columns = fixedColumns != null ? fixedColumns : readHeader();
        processColumns(columns);
        this.records = new AbstractIterator<R>() {
            @Override
            protected R computeNext() {
                try {
                    final R record = fetchNextRecord();
                    return record == null ? endOfData() : record;
                } catch (final IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
        };
    }

    private TableColumnCollection readHeader() throws IOException {
        final String[] line = nextDataLine();
        if (line == null) {
            throw formatException("no header line");
        }
        return new TableColumnCollection(line, this::formatException);
    }

    /**
     * @return the next line that is neither blank nor a comment, or {@code null} at the end of the input.
     */
    private String[] nextDataLine() throws IOException {
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            final boolean blank = line.length == 0 || (line.length == 1 && line[0].trim().isEmpty());
            if (!blank && !line[0].startsWith(TableUtils.COMMENT_PREFIX)) {
                return line;
            }
        }
        return null;
    }

    private R fetchNextRecord() throws IOException {
        String[] line;
        while ((line = nextDataLine()) != null) {
            if (columns.isHeader(line)) {
                continue;
            }
            if (line.length != columns.columnCount()) {
                throw formatException(String.format("%d values where %d columns are expected", line.length, columns.columnCount()));
            }
            final R record = createRecord(new DataLine(line, columns, this::formatException));
            if (record != null) {
                return record;
            }
        }
        return null;
    }

    /**
     * @return an exception naming the source and the line being read; the caller throws it.
     */
    protected final UserException.BadInput formatException(final String message) {
        final String where = source == null ? "" : " in '" + source + "'";
        return new UserException.BadInput(String.format("format error%s at line %d: %s", where, lineReader.getLineNumber(), message));
    }

    /**
     * Called once with the columns of the table, before any record is read. Subclasses check for mandatory
     * columns here.
     */
    protected void processColumns(final TableColumnCollection columns) {}

    /**
     * @return {@code null} to skip the line.
     */
    protected abstract R createRecord(final DataLine dataLine);

    public TableColumnCollection columns() {
        return columns;
    }

    public String getSource() {
        return source;
    }

    /**
     * @return the next record, or {@code null} at the end of the input.
     */
    public final R readRecord() {
        return records.hasNext() ? records.next() : null;
    }

    /**
     * Iterates over the remaining records; I/O failures surface as {@link UncheckedIOException}.
     */
    @Override
    public Iterator<R> iterator() {
        return records;
    }

    public List<R> toList() {
        final List<R> result = new ArrayList<>();
        records.forEachRemaining(result::add);
        return result;
    }

    @Override
    public void close() throws IOException {
        csvReader.close();
    }
}
