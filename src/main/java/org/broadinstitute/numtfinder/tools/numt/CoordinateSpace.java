package org.broadinstitute.numtfinder.tools.numt;

/**
 * The coordinate system a {@link ReferenceInterval} is expressed in.
 */
public enum CoordinateSpace {
    /** Positions {@code 1..L} on the circular reference; an interval may wrap the origin. */
    TRUE,
    /** Positions on the reference the aligner searched, {@code 1..2L} for a doubled circular reference. */
    DOUBLED
}
