package org.broadinstitute.numtfinder.utils;

import htsjdk.samtools.util.Locatable;

import java.io.Serializable;
import java.util.Comparator;

/**
 * Orders {@link Locatable}s by contig name (lexicographically), then start, then end.
 * Assembly sequences have no dictionary order here, so the name is the only stable key.
 */
public final class LocatableComparator implements Comparator<Locatable>, Serializable {
    private static final long serialVersionUID = 1L;

    public static final LocatableComparator INSTANCE = new LocatableComparator();

    @Override
    public int compare(final Locatable first, final Locatable second) {
        int result = first.getContig().compareTo(second.getContig());
        if (result == 0) {
            result = Integer.compare(first.getStart(), second.getStart());
            if (result == 0) {
                result = Integer.compare(first.getEnd(), second.getEnd());
            }
        }
        return result;
    }
}
