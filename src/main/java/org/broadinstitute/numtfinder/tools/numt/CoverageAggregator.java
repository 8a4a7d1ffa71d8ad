package org.broadinstitute.numtfinder.tools.numt;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.numtfinder.utils.Utils;

import java.util.List;

/**
 * Builds the depth of fragment coverage at every position of the true reference.
 */
public final class CoverageAggregator {
    private static final Logger logger = LogManager.getLogger(CoverageAggregator.class);

    private final CircularCoordinates coordinates;

    public CoverageAggregator(final CircularCoordinates coordinates) {
        this.coordinates = Utils.nonNull(coordinates, "coordinates");
    }

    /**
     * @param locus name of the reference, reported in the depth table
     */
    public CoverageProfile aggregate(final String locus, final List<NumtFragment> fragments) {
        Utils.nonNull(fragments, "fragments");
        final int length = coordinates.getReferenceLength();
        // difference array: +1 at each piece start, -1 just past its end
        final int[] delta = new int[length + 2];
        for (final NumtFragment fragment : fragments) {
            for (final ReferenceInterval piece : coordinates.split(fragment.getReference())) {
                delta[piece.getStart()]++;
                delta[piece.getEnd() + 1]--;
            }
        }
        final int[] depth = new int[length];
        int running = 0;
        for (int position = 1; position <= length; position++) {
            running += delta[position];
            depth[position - 1] = running;
        }
        final CoverageProfile profile = new CoverageProfile(locus, depth);
        logger.info(String.format("%s coverage: %d of %d bp covered (%s%%), max depth %d",
                locus, profile.getCoveredBases(), length, Utils.formattedPercent(profile.getCoveredBases(), length), profile.getMaxDepth()));
        return profile;
    }
}
