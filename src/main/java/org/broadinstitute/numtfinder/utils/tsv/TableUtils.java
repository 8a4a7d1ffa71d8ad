package org.broadinstitute.numtfinder.utils.tsv;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.numtfinder.utils.Utils;

import java.io.IOException;
import java.io.Writer;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Tab separated table conventions shared by {@link TableReader} and {@link TableWriter}.
 */
public final class TableUtils {

    public static final char COLUMN_SEPARATOR = '\t';

    public static final String COLUMN_SEPARATOR_STRING = String.valueOf(COLUMN_SEPARATOR);

    /** Marks a comment line when it starts the line; leading spaces are not ignored. */
    public static final String COMMENT_PREFIX = "#";

    static final char QUOTE_CHARACTER = '"';

    static final char ESCAPE_CHARACTER = '\\';

    private TableUtils() {}

    /**
     * Creates a writer whose lines are composed by a lambda rather than a subclass.
     */
    public static <R> TableWriter<R> writer(final Writer writer, final TableColumnCollection columns,
                                            final BiConsumer<R, DataLine> composer) throws IOException {
        Utils.nonNull(composer, "composer");
        return new TableWriter<R>(writer, columns) {
            @Override
            protected void composeLine(final R record, final DataLine dataLine) {
                composer.accept(record, dataLine);
            }
        };
    }

    /**
     * @throws RuntimeException made by {@code errorFactory} naming every missing column
     */
    public static void checkMandatoryColumns(final TableColumnCollection columns, final TableColumnCollection mandatory,
                                             final Function<String, RuntimeException> errorFactory) {
        final Set<String> missing = columns.missing(mandatory);
        if (!missing.isEmpty()) {
            throw errorFactory.apply("missing mandatory columns " + StringUtils.join(missing, ", ") +
                    "; the header has " + StringUtils.join(columns.names(), ", "));
        }
    }
}
