package org.broadinstitute.numtfinder.utils.tsv;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import org.broadinstitute.numtfinder.utils.Utils;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Ordered, duplicate-free column names of a table.
 */
public final class TableColumnCollection {

    private final List<String> names;

    private final Map<String, Integer> indexByName;

    /**
     * @throws IllegalArgumentException if there are no names, a name repeats, or the first one looks like a comment.
     */
    public TableColumnCollection(final String... names) {
        this(names, IllegalArgumentException::new);
    }

    TableColumnCollection(final String[] names, final Function<String, RuntimeException> errorFactory) {
        Utils.nonNull(names, "column names cannot be null");
        if (names.length == 0) {
            throw errorFactory.apply("a table needs at least one column");
        }
        if (names[0] != null && names[0].startsWith(TableUtils.COMMENT_PREFIX)) {
            throw errorFactory.apply("the first column name cannot start with " + TableUtils.COMMENT_PREFIX);
        }
        indexByName = new HashMap<>(names.length);
        for (int i = 0; i < names.length; i++) {
            final String name = Utils.nonNull(names[i], "column name " + i + " is null");
            if (indexByName.put(name, i) != null) {
                throw errorFactory.apply("repeated column name: " + name);
            }
        }
        this.names = ImmutableList.copyOf(names);
    }

    public List<String> names() {
        return names;
    }

    public int columnCount() {
        return names.size();
    }

    /**
     * @return -1 if there is no such column.
     */
    public int indexOf(final String name) {
        return indexByName.getOrDefault(Utils.nonNull(name, "column name"), -1);
    }

    public boolean contains(final String name) {
        return indexOf(name) >= 0;
    }

    String nameAt(final int index) {
        return names.get(index);
    }

    /**
     * @return the names of {@code required} that this collection lacks, in their order.
     */
    public Set<String> missing(final TableColumnCollection required) {
        return Sets.difference(new LinkedHashSet<>(required.names), indexByName.keySet()).immutableCopy();
    }

    /**
     * @return whether a line read from a table is a repeat of this header.
     */
    boolean isHeader(final String[] line) {
        return line.length == names.size() && names.equals(ImmutableList.copyOf(line));
    }

    @Override
    public String toString() {
        return String.join(TableUtils.COLUMN_SEPARATOR_STRING, names);
    }
}
