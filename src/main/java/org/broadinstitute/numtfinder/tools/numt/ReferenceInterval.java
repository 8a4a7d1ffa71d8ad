package org.broadinstitute.numtfinder.tools.numt;

import org.broadinstitute.numtfinder.utils.Utils;

import java.io.Serializable;

/**
 * A 1-based closed interval on the mitochondrial reference.
 * <p>
 * In {@link CoordinateSpace#TRUE} space {@code end < start} is allowed and means the interval wraps the
 * circular origin. In {@link CoordinateSpace#DOUBLED} space {@code start <= end} always holds.
 * </p>
 */
public final class ReferenceInterval implements Serializable {
    private static final long serialVersionUID = 1L;

    private final int start;
    private final int end;
    private final CoordinateSpace space;

    public ReferenceInterval(final int start, final int end, final CoordinateSpace space) {
        Utils.nonNull(space, "space");
        Utils.validateArg(start > 0 && end > 0, () -> "Reference positions must be positive: " + start + "-" + end);
        Utils.validateArg(space == CoordinateSpace.TRUE || start <= end,
                () -> "Doubled reference interval must have start <= end: " + start + "-" + end);
        this.start = start;
        this.end = end;
        this.space = space;
    }

    public static ReferenceInterval doubled(final int start, final int end) {
        return new ReferenceInterval(start, end, CoordinateSpace.DOUBLED);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public CoordinateSpace getSpace() {
        return space;
    }

    /**
     * @return true if this interval crosses the circular origin.
     */
    public boolean isWrapped() {
        return end < start;
    }

    /**
     * Number of positions between start and end; only meaningful for non-wrapping intervals.
     * Use {@link CircularCoordinates#referenceLength} for wrapped ones.
     */
    public int span() {
        Utils.validate(!isWrapped(), "span of a wrapped interval depends on the reference length");
        return end - start + 1;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final ReferenceInterval that = (ReferenceInterval) o;
        return start == that.start && end == that.end && space == that.space;
    }

    @Override
    public int hashCode() {
        int result = start;
        result = 31 * result + end;
        result = 31 * result + space.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return start + "-" + end + (space == CoordinateSpace.DOUBLED ? "(2X)" : "");
    }
}
