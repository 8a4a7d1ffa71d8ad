package org.broadinstitute.numtfinder.tools.numt;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.broadinstitute.numtfinder.utils.Utils;

import java.util.Arrays;

/**
 * Per-position fragment depth along the true mitochondrial reference, positions {@code 1..L}.
 */
public final class CoverageProfile {

    private final String locus;
    private final int[] depth;

    CoverageProfile(final String locus, final int[] depth) {
        this.locus = Utils.nonNull(locus, "locus");
        Utils.nonNull(depth, "depth");
        Utils.validateArg(depth.length > 0, "A coverage profile needs at least one position");
        this.depth = depth.clone();
    }

    public String getLocus() {
        return locus;
    }

    public int getLength() {
        return depth.length;
    }

    /**
     * @param position 1-based position on the true reference
     */
    public int getDepth(final int position) {
        Utils.validateArg(position >= 1 && position <= depth.length,
                () -> String.format("Position %d outside 1-%d", position, depth.length));
        return depth[position - 1];
    }

    public int[] getDepths() {
        return depth.clone();
    }

    public int getCoveredBases() {
        return (int) Arrays.stream(depth).filter(d -> d > 0).count();
    }

    public double getCoveredPercent() {
        return 100.0 * getCoveredBases() / depth.length;
    }

    public long getTotalDepth() {
        return Arrays.stream(depth).asLongStream().sum();
    }

    public double getMeanDepth() {
        return (double) getTotalDepth() / depth.length;
    }

    public double getMedianDepth() {
        return new Median().evaluate(Arrays.stream(depth).asDoubleStream().toArray());
    }

    public int getMaxDepth() {
        return Arrays.stream(depth).max().orElse(0);
    }
}
