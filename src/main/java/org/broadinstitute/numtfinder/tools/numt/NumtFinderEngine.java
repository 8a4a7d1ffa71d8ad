package org.broadinstitute.numtfinder.tools.numt;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.numtfinder.cmdline.argumentcollections.NumtFinderArgumentCollection;
import org.broadinstitute.numtfinder.exceptions.NumtFinderException;
import org.broadinstitute.numtfinder.utils.Utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs the fragment reduction pipeline on a set of alignment hits:
 * length filter, uniquify, projection onto the true reference, self-hit filtering, block merging and
 * coverage aggregation. Each stage returns new collections; the engine itself keeps no state between runs.
 */
public final class NumtFinderEngine {
    private static final Logger logger = LogManager.getLogger(NumtFinderEngine.class);

    private final NumtFinderArgumentCollection arguments;
    private final CircularCoordinates coordinates;
    private final String referenceName;

    private final AlignmentUniquifier uniquifier = new AlignmentUniquifier();
    private final CoordinateProjector projector;
    private final SelfHitFilter selfHitFilter;
    private final BlockMerger blockMerger;
    private final CoverageAggregator coverageAggregator;

    /**
     * @param referenceName name of the true (not doubled) mitochondrial reference, used as the coverage locus
     */
    public NumtFinderEngine(final NumtFinderArgumentCollection arguments, final CircularCoordinates coordinates,
                            final String referenceName) {
        this.arguments = Utils.nonNull(arguments, "arguments");
        this.coordinates = Utils.nonNull(coordinates, "coordinates");
        this.referenceName = Utils.nonEmpty(referenceName, "referenceName");
        Utils.validateArg(coordinates.isCircular() == arguments.circular,
                "reference coordinates and arguments disagree on circularity");
        arguments.validate();
        projector = new CoordinateProjector(coordinates);
        selfHitFilter = new SelfHitFilter(coordinates, arguments.selfHitCoverage, arguments.selfHitIdentity, arguments.autoExclude);
        blockMerger = new BlockMerger(arguments.fragmentMerge, arguments.stranded);
        coverageAggregator = new CoverageAggregator(coordinates);
    }

    /**
     * @param hits raw alignment hits, any order
     * @param exclusions assembly sequences to leave out of the output, in addition to excluded self-hits
     */
    public NumtFinderResult run(final List<AlignmentHit> hits, final Collection<String> exclusions) {
        Utils.nonNull(hits, "hits");
        Utils.nonNull(exclusions, "exclusions");
        final List<String> warnings = new ArrayList<>();
        logger.info(String.format("Processing %d hits against %s (%s)", hits.size(), coordinates, referenceName));

        final List<AlignmentHit> longEnough = filterByLength(hits, warnings);
        final List<AlignmentHit> unique = uniquifier.uniquifyAll(longEnough);
        checkNoOverlaps(unique);
        final List<NumtFragment> fragments = projector.toFragments(unique);

        final long wrapped = fragments.stream().filter(NumtFragment::isWrapped).count();
        if (wrapped > 0) {
            warn(warnings, String.format("%d fragments span the reference origin; their mtEnd is smaller than their mtStart", wrapped));
        }

        final SelfHitFilter.Result filtered = selfHitFilter.filter(fragments, exclusions);
        warnings.addAll(filtered.getWarnings());
        final List<NumtFragment> kept = filtered.getFragments();
        if (kept.isEmpty()) {
            warn(warnings, "No NUMT fragments remain after filtering; the block and coverage output will be empty");
        }

        final List<NumtBlock> blocks = blockMerger.merge(kept);
        final List<NumtBlock> mixed = blocks.stream()
                .filter(b -> b.getStrand() == BlockStrand.MIXED)
                .collect(Collectors.toList());
        if (!mixed.isEmpty()) {
            warn(warnings, String.format("%d blocks combine fragments from both strands: %s", mixed.size(),
                    mixed.stream().map(b -> b.getInterval().toString()).collect(Collectors.joining(", "))));
        }

        final CoverageProfile coverage = coverageAggregator.aggregate(referenceName, kept);
        return new NumtFinderResult(kept, blocks, coverage, filtered.getCalls(), filtered.getExclusions(), warnings);
    }

    private List<AlignmentHit> filterByLength(final List<AlignmentHit> hits, final List<String> warnings) {
        if (arguments.minFragmentLength <= 0) {
            return hits;
        }
        final Set<String> before = new LinkedHashSet<>();
        final Set<String> after = new LinkedHashSet<>();
        final List<AlignmentHit> kept = new ArrayList<>(hits.size());
        for (final AlignmentHit hit : hits) {
            before.add(hit.getSequenceName());
            if (hit.getAlignedLength() >= arguments.minFragmentLength) {
                kept.add(hit);
                after.add(hit.getSequenceName());
            }
        }
        logger.info(String.format("%d of %d hits are at least %d bp long", kept.size(), hits.size(), arguments.minFragmentLength));
        before.removeAll(after);
        for (final String lost : before) {
            warn(warnings, String.format("Sequence %s has no hits of at least %d bp and yields no fragments", lost, arguments.minFragmentLength));
        }
        return kept;
    }

    private static void checkNoOverlaps(final List<AlignmentHit> sortedHits) {
        for (int i = 1; i < sortedHits.size(); i++) {
            final AlignmentHit previous = sortedHits.get(i - 1);
            final AlignmentHit hit = sortedHits.get(i);
            if (previous.getInterval().overlaps(hit.getInterval())) {
                throw new NumtFinderException.InvariantViolation("uniquification",
                        previous.getInterval() + " overlaps " + hit.getInterval());
            }
        }
    }

    private static void warn(final List<String> warnings, final String message) {
        logger.warn(message);
        warnings.add(message);
    }
}
