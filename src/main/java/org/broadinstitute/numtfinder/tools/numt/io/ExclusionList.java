package org.broadinstitute.numtfinder.tools.numt.io;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.numtfinder.exceptions.UserException;
import org.broadinstitute.numtfinder.utils.Utils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads and writes exclusion lists: plain text, one assembly sequence id per line. Blank lines and
 * lines starting with {@code #} are ignored on reading.
 */
public final class ExclusionList {

    // same line end as the tables
    private static final String LINE_SEPARATOR = "\n";

    private static final List<String> PARSER_EXPANSION_EXTENSIONS = Arrays.asList(".list", ".args");

    private ExclusionList() {}

    /**
     * Expands the raw {@code --exclude} values: a value naming an existing regular file is replaced by
     * the ids listed in it, any other value is taken as an id. The argument parser has already replaced
     * {@code .list} and {@code .args} files by their lines, so such names are left to it and taken as ids here.
     */
    public static Set<String> resolve(final Collection<String> values) {
        Utils.nonNull(values, "values");
        final Set<String> result = new LinkedHashSet<>();
        for (final String value : values) {
            final Path asPath = toPathOrNull(value);
            if (asPath != null && !isParserExpansionFile(value) && Files.isRegularFile(asPath)) {
                result.addAll(read(asPath));
            } else {
                result.add(value.trim());
            }
        }
        return result;
    }

    public static List<String> read(final Path path) {
        Utils.nonNull(path, "path");
        try {
            final List<String> ids = new ArrayList<>();
            for (final String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
                final String id = line.trim();
                if (!id.isEmpty() && !id.startsWith("#")) {
                    ids.add(id);
                }
            }
            return ids;
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }

    public static void write(final File file, final Collection<String> ids) {
        Utils.nonNull(file, "file");
        Utils.nonNull(ids, "ids");
        final String content = ids.isEmpty() ? "" : StringUtils.join(ids, LINE_SEPARATOR) + LINE_SEPARATOR;
        try {
            Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(file, e);
        }
    }

    private static boolean isParserExpansionFile(final String value) {
        return PARSER_EXPANSION_EXTENSIONS.stream().anyMatch(value::endsWith);
    }

    private static Path toPathOrNull(final String value) {
        try {
            return value == null || value.isEmpty() ? null : Path.of(value);
        } catch (final InvalidPathException e) {
            return null;
        }
    }
}
