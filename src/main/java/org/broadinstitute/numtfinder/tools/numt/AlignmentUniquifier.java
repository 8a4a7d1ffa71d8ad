package org.broadinstitute.numtfinder.tools.numt;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.numtfinder.utils.LocatableComparator;
import org.broadinstitute.numtfinder.utils.Utils;

import java.util.*;

/**
 * Reduces the alignment hits of an assembly sequence to a set of hits that do not overlap each other.
 * <p>
 * Hits are visited from the most to the least identical bases, ties keeping their input order, and a hit
 * is kept unless it shares at least one assembly position with a hit already kept. This is a greedy cover,
 * not an optimal one.
 * </p>
 */
public final class AlignmentUniquifier {
    private static final Logger logger = LogManager.getLogger(AlignmentUniquifier.class);

    private static final Comparator<AlignmentHit> BY_IDENTITY_DESCENDING =
            Comparator.comparingInt(AlignmentHit::getIdentity).reversed();

    /**
     * @param hits hits of a single assembly sequence
     * @return the kept hits in ascending assembly order
     * @throws IllegalArgumentException if the hits come from more than one sequence
     */
    public List<AlignmentHit> uniquify(final List<AlignmentHit> hits) {
        Utils.nonNull(hits, "hits");
        Utils.containsNoNull(hits, "hits cannot contain null");
        if (hits.isEmpty()) {
            return Collections.emptyList();
        }
        final String sequenceName = hits.get(0).getSequenceName();
        Utils.validateArg(hits.stream().allMatch(h -> h.getSequenceName().equals(sequenceName)),
                () -> "Hits from more than one sequence passed for uniquification, expected only " + sequenceName);

        final List<AlignmentHit> ranked = new ArrayList<>(hits);
        ranked.sort(BY_IDENTITY_DESCENDING);

        // kept hits keyed by start; they never overlap so the closest start at or before a candidate's end is the only possible clash
        final TreeMap<Integer, AlignmentHit> kept = new TreeMap<>();
        for (final AlignmentHit hit : ranked) {
            final Map.Entry<Integer, AlignmentHit> closest = kept.floorEntry(hit.getEnd());
            if (closest == null || closest.getValue().getEnd() < hit.getStart()) {
                kept.put(hit.getStart(), hit);
            }
        }
        logger.debug(String.format("%s: %d hits -> %d unique", sequenceName, hits.size(), kept.size()));
        return new ArrayList<>(kept.values());
    }

    /**
     * Uniquifies each assembly sequence of a mixed hit list independently.
     *
     * @return the kept hits ordered by sequence name then position
     */
    public List<AlignmentHit> uniquifyAll(final List<AlignmentHit> hits) {
        Utils.nonNull(hits, "hits");
        final Map<String, List<AlignmentHit>> bySequence = new LinkedHashMap<>();
        for (final AlignmentHit hit : hits) {
            bySequence.computeIfAbsent(hit.getSequenceName(), k -> new ArrayList<>()).add(hit);
        }
        final List<AlignmentHit> result = new ArrayList<>();
        bySequence.values().forEach(sequenceHits -> result.addAll(uniquify(sequenceHits)));
        result.sort(LocatableComparator.INSTANCE);
        logger.info(String.format("Uniquified %d hits on %d sequences into %d non-overlapping hits",
                hits.size(), bySequence.size(), result.size()));
        return result;
    }
}
