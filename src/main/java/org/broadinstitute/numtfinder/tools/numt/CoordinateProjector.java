package org.broadinstitute.numtfinder.tools.numt;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.numtfinder.exceptions.UserException;
import org.broadinstitute.numtfinder.utils.LocatableComparator;
import org.broadinstitute.numtfinder.utils.Utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns uniquified hits into {@link NumtFragment}s: projects their reference coordinates from the searched
 * space onto the true reference and numbers them.
 */
public final class CoordinateProjector {
    private static final Logger logger = LogManager.getLogger(CoordinateProjector.class);

    private final CircularCoordinates coordinates;

    public CoordinateProjector(final CircularCoordinates coordinates) {
        this.coordinates = Utils.nonNull(coordinates, "coordinates");
    }

    /**
     * @return the hit's reference interval on the true reference; {@code end < start} when it spans the origin.
     * @throws UserException.BadInput if the hit lies outside the searched reference.
     */
    public ReferenceInterval project(final AlignmentHit hit) {
        Utils.nonNull(hit, "hit");
        final ReferenceInterval reference = hit.getReference();
        if (!coordinates.isValidSearchPosition(reference.getStart()) || !coordinates.isValidSearchPosition(reference.getEnd())) {
            throw new UserException.BadInput(String.format("Reference coordinates %d-%d of hit on %s lie outside the %s reference 1-%d",
                    reference.getStart(), reference.getEnd(), hit.getInterval(),
                    coordinates.isCircular() ? "doubled" : "linear", coordinates.getSearchLength()));
        }
        return coordinates.project(reference);
    }

    /**
     * Projects every hit and assigns fragment numbers 1, 2, 3... in sequence name, start, end order.
     */
    public List<NumtFragment> toFragments(final List<AlignmentHit> hits) {
        Utils.nonNull(hits, "hits");
        final List<AlignmentHit> ordered = new ArrayList<>(hits);
        ordered.sort(LocatableComparator.INSTANCE);
        final List<NumtFragment> fragments = new ArrayList<>(ordered.size());
        int wrapped = 0;
        for (final AlignmentHit hit : ordered) {
            final NumtFragment fragment = new NumtFragment(fragments.size() + 1, hit, project(hit));
            if (fragment.isWrapped()) {
                wrapped++;
                logger.debug("Fragment spans the reference origin: " + fragment);
            }
            fragments.add(fragment);
        }
        logger.info(String.format("Projected %d fragments onto the %d bp reference (%d spanning the origin)",
                fragments.size(), coordinates.getReferenceLength(), wrapped));
        return fragments;
    }
}
