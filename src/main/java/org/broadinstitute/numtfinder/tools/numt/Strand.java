package org.broadinstitute.numtfinder.tools.numt;

import org.broadinstitute.numtfinder.utils.Utils;

/**
 * Orientation of an assembly alignment relative to the mitochondrial reference.
 */
public enum Strand {
    PLUS("+"),
    MINUS("-");

    private final String symbol;

    Strand(final String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * @throws IllegalArgumentException if {@code symbol} is neither {@code +} nor {@code -}.
     */
    public static Strand fromSymbol(final String symbol) {
        Utils.nonNull(symbol, "strand symbol");
        for (final Strand strand : values()) {
            if (strand.symbol.equals(symbol.trim())) {
                return strand;
            }
        }
        throw new IllegalArgumentException("Unknown strand symbol: " + symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
