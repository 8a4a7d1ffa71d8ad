package org.broadinstitute.numtfinder.tools.numt;

import org.broadinstitute.numtfinder.utils.Utils;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Coordinate arithmetic between the doubled search reference and the true circular reference.
 * <p>
 * For a circular reference of length {@code L} the searched sequence spans {@code 1..2L}, and a doubled
 * position {@code c} maps to {@code ((c - 1) mod L) + 1}. For a linear reference both spaces are the
 * same {@code 1..L} and projection is the identity.
 * </p>
 */
public final class CircularCoordinates {

    private final int referenceLength;
    private final boolean circular;

    public CircularCoordinates(final int referenceLength, final boolean circular) {
        Utils.validateArg(referenceLength > 0, () -> "Reference length must be positive but was " + referenceLength);
        this.referenceLength = referenceLength;
        this.circular = circular;
    }

    public int getReferenceLength() {
        return referenceLength;
    }

    public boolean isCircular() {
        return circular;
    }

    /**
     * @return the largest valid position in doubled space: {@code 2L} if circular, otherwise {@code L}.
     */
    public int getSearchLength() {
        return circular ? 2 * referenceLength : referenceLength;
    }

    public boolean isValidSearchPosition(final int position) {
        return position >= 1 && position <= getSearchLength();
    }

    /**
     * Maps a doubled-space position onto the true reference.
     */
    public int toTrue(final int position) {
        Utils.validateArg(isValidSearchPosition(position),
                () -> String.format("Position %d outside the search reference 1-%d", position, getSearchLength()));
        return ((position - 1) % referenceLength) + 1;
    }

    /**
     * Projects a doubled-space interval onto the true reference.
     * An interval spanning {@code L} or more positions covers the whole circle and is clamped to
     * exactly {@code L} positions starting at the projected start.
     */
    public ReferenceInterval project(final ReferenceInterval interval) {
        Utils.nonNull(interval, "interval");
        Utils.validateArg(interval.getSpace() == CoordinateSpace.DOUBLED, "Only doubled-space intervals can be projected");
        final int start = toTrue(interval.getStart());
        final int end;
        if (interval.span() >= referenceLength) {
            end = start == 1 ? referenceLength : start - 1;
        } else {
            end = toTrue(interval.getEnd());
        }
        return new ReferenceInterval(start, end, CoordinateSpace.TRUE);
    }

    /**
     * @return number of true reference positions covered by {@code interval}, counting across the origin if it wraps.
     */
    public int referenceLength(final ReferenceInterval interval) {
        return split(interval).stream().mapToInt(ReferenceInterval::span).sum();
    }

    /**
     * Splits a true-space interval into the non-wrapping pieces it covers: itself, or
     * {@code [start, L]} and {@code [1, end]} when it wraps.
     */
    public List<ReferenceInterval> split(final ReferenceInterval interval) {
        Utils.nonNull(interval, "interval");
        Utils.validateArg(interval.getSpace() == CoordinateSpace.TRUE, "Only true-space intervals can be split");
        Utils.validateArg(interval.getStart() <= referenceLength && interval.getEnd() <= referenceLength,
                () -> "Interval " + interval + " lies outside the reference length " + referenceLength);
        if (!interval.isWrapped()) {
            return Collections.singletonList(interval);
        }
        return Arrays.asList(
                new ReferenceInterval(interval.getStart(), referenceLength, CoordinateSpace.TRUE),
                new ReferenceInterval(1, interval.getEnd(), CoordinateSpace.TRUE));
    }

    @Override
    public String toString() {
        return "CircularCoordinates{length=" + referenceLength + ", circular=" + circular + "}";
    }
}
