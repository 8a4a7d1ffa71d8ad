package org.broadinstitute.numtfinder.tools.numt;

import org.broadinstitute.numtfinder.utils.Utils;

/**
 * Strand of a NUMT block: the strand of its fragments, or {@link #MIXED} once fragments of both strands joined.
 */
public enum BlockStrand {
    PLUS("+"),
    MINUS("-"),
    MIXED("+/-");

    private final String symbol;

    BlockStrand(final String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public static BlockStrand of(final Strand strand) {
        return Utils.nonNull(strand) == Strand.PLUS ? PLUS : MINUS;
    }

    /**
     * @return the strand of a block after a fragment on {@code strand} joins it.
     */
    public BlockStrand combine(final Strand strand) {
        return this == of(strand) ? this : MIXED;
    }

    /**
     * @return whether a fragment on {@code strand} has the same orientation as this block.
     */
    public boolean matches(final Strand strand) {
        return this == of(strand);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
