package org.broadinstitute.numtfinder.utils;

import htsjdk.samtools.util.Locatable;

import java.io.Serializable;
import java.util.Objects;

/**
 * Immutable 1-based closed interval {@code [start, end]} on an assembly sequence.
 * Printed as {@code contig:start-end}, the form used in log messages and block warnings.
 */
public final class SimpleInterval implements Locatable, Serializable {
    private static final long serialVersionUID = 1L;

    private final String contig;
    private final int start;
    private final int end;

    /**
     * @throws IllegalArgumentException if {@code contig} is {@code null}, {@code start < 1} or {@code end < start}
     */
    public SimpleInterval(final String contig, final int start, final int end) {
        Utils.validateArg(contig != null && start >= 1 && end >= start,
                () -> String.format("invalid interval %s:%d-%d", contig, start, end));
        this.contig = contig;
        this.start = start;
        this.end = end;
    }

    @Override
    public String getContig() {
        return contig;
    }

    @Override
    public int getStart() {
        return start;
    }

    @Override
    public int getEnd() {
        return end;
    }

    public int size() {
        return end - start + 1;
    }

    /**
     * @return whether both intervals are on the same sequence and share at least one position
     */
    public boolean overlaps(final Locatable other) {
        return contig.equals(other.getContig()) && start <= other.getEnd() && other.getStart() <= end;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof SimpleInterval)) return false;
        final SimpleInterval that = (SimpleInterval) o;
        return start == that.start && end == that.end && contig.equals(that.contig);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contig, start, end);
    }

    @Override
    public String toString() {
        return contig + ":" + start + "-" + end;
    }
}
