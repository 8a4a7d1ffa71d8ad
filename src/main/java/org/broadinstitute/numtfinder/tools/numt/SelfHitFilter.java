package org.broadinstitute.numtfinder.tools.numt;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.numtfinder.utils.Utils;
import org.broadinstitute.numtfinder.utils.param.ParamUtils;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Finds assembly sequences that are near-complete copies of the mitochondrial reference, i.e. the assembled
 * mitochondrion itself, and removes their fragments.
 * <p>
 * For each sequence the fragments are taken from most to fewest identical bases until the union of their
 * reference intervals reaches the coverage threshold. Those are the contributing fragments; coverage is the union
 * over the reference length and identity is their identical bases over their aligned bases. A sequence
 * reaching both thresholds is a self-hit. Its fragments lying outside the assembly span of the contributing
 * ones suggest a mitochondrial contig that also carries a NUMT and are reported as a warning.
 * </p>
 */
public final class SelfHitFilter {
    private static final Logger logger = LogManager.getLogger(SelfHitFilter.class);

    private final CircularCoordinates coordinates;
    private final double coverageThreshold;
    private final double identityThreshold;
    private final boolean autoExclude;

    /**
     * @param coverageThreshold minimum percentage of the reference covered by a self-hit
     * @param identityThreshold minimum percent identity of a self-hit
     * @param autoExclude whether self-hits are added to the exclusion set, or only reported
     */
    public SelfHitFilter(final CircularCoordinates coordinates, final double coverageThreshold,
                         final double identityThreshold, final boolean autoExclude) {
        this.coordinates = Utils.nonNull(coordinates, "coordinates");
        this.coverageThreshold = ParamUtils.isPercentage(coverageThreshold, "Self-hit coverage threshold must be between 0 and 100");
        this.identityThreshold = ParamUtils.isPercentage(identityThreshold, "Self-hit identity threshold must be between 0 and 100");
        this.autoExclude = autoExclude;
    }

    /**
     * Outcome of a filtering pass.
     */
    public static final class Result {
        private final Set<String> exclusions;
        private final List<NumtFragment> fragments;
        private final List<SelfHitCall> calls;
        private final List<String> warnings;

        Result(final Set<String> exclusions, final List<NumtFragment> fragments, final List<SelfHitCall> calls, final List<String> warnings) {
            this.exclusions = Collections.unmodifiableSet(exclusions);
            this.fragments = Collections.unmodifiableList(fragments);
            this.calls = Collections.unmodifiableList(calls);
            this.warnings = Collections.unmodifiableList(warnings);
        }

        /** Starting exclusions plus the self-hits excluded by this pass, in that order. */
        public Set<String> getExclusions() {
            return exclusions;
        }

        /** Fragments whose sequence is not excluded, in input order. */
        public List<NumtFragment> getFragments() {
            return fragments;
        }

        public List<SelfHitCall> getCalls() {
            return calls;
        }

        public List<String> getWarnings() {
            return warnings;
        }
    }

    public Result filter(final List<NumtFragment> fragments, final Collection<String> startingExclusions) {
        Utils.nonNull(fragments, "fragments");
        Utils.nonNull(startingExclusions, "startingExclusions");
        final Set<String> exclusions = new LinkedHashSet<>(startingExclusions);
        final List<SelfHitCall> calls = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();

        final Map<String, List<NumtFragment>> bySequence = new TreeMap<>();
        for (final NumtFragment fragment : fragments) {
            bySequence.computeIfAbsent(fragment.getContig(), k -> new ArrayList<>()).add(fragment);
        }

        for (final Map.Entry<String, List<NumtFragment>> entry : bySequence.entrySet()) {
            final SelfHitCall call = assess(entry.getKey(), entry.getValue());
            if (call == null) {
                continue;
            }
            calls.add(call);
            if (call.isExcluded()) {
                exclusions.add(call.getSequenceName());
            }
            logger.info(String.format("Self-hit %s: %.2f%% coverage at %.2f%% identity from %d fragments%s",
                    call.getSequenceName(), call.getCoveragePercent(), call.getIdentityPercent(),
                    call.getContributingFragNums().size(), call.isExcluded() ? " (excluded)" : " (reported only)"));
            if (call.hasExtraFragments()) {
                final String warning = String.format("Self-hit sequence %s has %d fragments outside its mitochondrial copy (%s): " +
                                "possibly a mitochondrial contig carrying a NUMT",
                        call.getSequenceName(), call.getExtraFragNums().size(), joinFragNums(call.getExtraFragNums()));
                logger.warn(warning);
                warnings.add(warning);
            }
        }

        final List<NumtFragment> kept = fragments.stream()
                .filter(f -> !exclusions.contains(f.getContig()))
                .collect(Collectors.toList());
        logger.info(String.format("%d of %d fragments remain after removing %d excluded sequences",
                kept.size(), fragments.size(), exclusions.size()));
        return new Result(exclusions, kept, calls, warnings);
    }

    /**
     * @return the call for a self-hit sequence, or {@code null} if the sequence is not one.
     */
    SelfHitCall assess(final String sequenceName, final List<NumtFragment> sequenceFragments) {
        final int length = coordinates.getReferenceLength();
        final List<NumtFragment> ranked = new ArrayList<>(sequenceFragments);
        ranked.sort(Comparator.comparingInt(NumtFragment::getIdentity).reversed());

        final BitSet covered = new BitSet(length + 1);
        final List<NumtFragment> contributing = new ArrayList<>();
        // the best fragment always contributes, even at a threshold of 0
        for (final NumtFragment fragment : ranked) {
            for (final ReferenceInterval piece : coordinates.split(fragment.getReference())) {
                covered.set(piece.getStart(), piece.getEnd() + 1);
            }
            contributing.add(fragment);
            if (coveragePercent(covered.cardinality(), length) >= coverageThreshold) {
                break;
            }
        }

        final double coverage = coveragePercent(covered.cardinality(), length);
        final long identical = contributing.stream().mapToLong(NumtFragment::getIdentity).sum();
        final long aligned = contributing.stream().mapToLong(NumtFragment::getAlignedLength).sum();
        final double identity = aligned == 0 ? 0.0 : 100.0 * identical / aligned;
        if (contributing.isEmpty() || coverage < coverageThreshold || identity < identityThreshold) {
            return null;
        }

        final int spanStart = contributing.stream().mapToInt(NumtFragment::getStart).min().getAsInt();
        final int spanEnd = contributing.stream().mapToInt(NumtFragment::getEnd).max().getAsInt();
        final List<Integer> extra = sequenceFragments.stream()
                .filter(f -> f.getStart() < spanStart || f.getEnd() > spanEnd)
                .map(NumtFragment::getFragNum)
                .sorted()
                .collect(Collectors.toList());
        final List<Integer> contributingNums = contributing.stream()
                .map(NumtFragment::getFragNum)
                .sorted()
                .collect(Collectors.toList());
        return new SelfHitCall(sequenceName, coverage, identity, contributingNums, extra, autoExclude);
    }

    private static double coveragePercent(final int coveredBases, final int length) {
        return 100.0 * coveredBases / length;
    }

    static String joinFragNums(final List<Integer> fragNums) {
        return fragNums.stream().map(String::valueOf).collect(Collectors.joining(NumtBlock.FRAG_NUM_SEPARATOR));
    }
}
