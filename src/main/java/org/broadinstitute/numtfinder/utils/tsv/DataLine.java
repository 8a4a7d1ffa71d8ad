package org.broadinstitute.numtfinder.utils.tsv;

import org.broadinstitute.numtfinder.utils.Utils;

import java.util.function.Function;

/**
 * One line of a table: the values read from a file, or the values a {@link TableWriter} fills in column order.
 * Values that do not parse are reported through the error factory of the owning reader, which knows the file
 * and line they came from.
 */
public final class DataLine {

    private final String[] values;

    private final TableColumnCollection columns;

    private final Function<String, RuntimeException> errorFactory;

    private int nextIndex = 0;

    DataLine(final String[] values, final TableColumnCollection columns, final Function<String, RuntimeException> errorFactory) {
        this.values = Utils.nonNull(values, "values");
        this.columns = Utils.nonNull(columns, "columns");
        this.errorFactory = Utils.nonNull(errorFactory, "errorFactory");
        Utils.validateArg(values.length == columns.columnCount(),
                () -> String.format("%d values for %d columns", values.length, columns.columnCount()));
    }

    /** A blank line to append values to. */
    DataLine(final TableColumnCollection columns) {
        this(new String[columns.columnCount()], columns, IllegalArgumentException::new);
    }

    public String get(final String columnName) {
        final int index = columns.indexOf(columnName);
        Utils.validateArg(index >= 0, () -> "no column " + columnName);
        return values[index];
    }

    public int getInt(final String columnName) {
        final String value = get(columnName);
        try {
            return Integer.parseInt(value.trim());
        } catch (final NumberFormatException e) {
            throw formatError(String.format("column %s holds '%s', not an integer", columnName, value));
        }
    }

    public double getDouble(final String columnName) {
        final String value = get(columnName);
        try {
            return Double.parseDouble(value.trim());
        } catch (final NumberFormatException e) {
            throw formatError(String.format("column %s holds '%s', not a number", columnName, value));
        }
    }

    /**
     * @return an exception for a problem with this line's content; the caller throws it.
     */
    public RuntimeException formatError(final String message) {
        return errorFactory.apply(message);
    }

    public DataLine append(final String value) {
        Utils.nonNull(value, "value");
        Utils.validate(nextIndex < values.length, "all " + values.length + " columns already have a value");
        if (nextIndex == 0 && value.startsWith(TableUtils.COMMENT_PREFIX)) {
            throw new IllegalArgumentException("a first column value cannot start with " + TableUtils.COMMENT_PREFIX + ": " + value);
        }
        values[nextIndex++] = value;
        return this;
    }

    public DataLine append(final int value) {
        return append(Integer.toString(value));
    }

    public DataLine append(final long value) {
        return append(Long.toString(value));
    }

    /**
     * @throws IllegalStateException if some column was left without a value
     */
    String[] unpack() {
        Utils.validate(nextIndex == values.length,
                () -> "no value for column " + columns.nameAt(nextIndex) + " and the ones after it");
        return values;
    }
}
