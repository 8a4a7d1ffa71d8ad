package org.broadinstitute.numtfinder.tools.numt;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Everything a {@link NumtFinderEngine} run produces. All collections are unmodifiable.
 */
public final class NumtFinderResult {
    private final List<NumtFragment> fragments;
    private final List<NumtBlock> blocks;
    private final CoverageProfile coverage;
    private final List<SelfHitCall> selfHits;
    private final Set<String> exclusions;
    private final List<String> warnings;

    NumtFinderResult(final List<NumtFragment> fragments, final List<NumtBlock> blocks, final CoverageProfile coverage,
                     final List<SelfHitCall> selfHits, final Set<String> exclusions, final List<String> warnings) {
        this.fragments = Collections.unmodifiableList(fragments);
        this.blocks = Collections.unmodifiableList(blocks);
        this.coverage = coverage;
        this.selfHits = Collections.unmodifiableList(selfHits);
        this.exclusions = Collections.unmodifiableSet(exclusions);
        this.warnings = Collections.unmodifiableList(warnings);
    }

    /** Fragments of the sequences that are not excluded, ordered by sequence and position. */
    public List<NumtFragment> getFragments() {
        return fragments;
    }

    public List<NumtBlock> getBlocks() {
        return blocks;
    }

    public CoverageProfile getCoverage() {
        return coverage;
    }

    public List<SelfHitCall> getSelfHits() {
        return selfHits;
    }

    /** The starting exclusions followed by any self-hit sequences excluded during the run. */
    public Set<String> getExclusions() {
        return exclusions;
    }

    /** Non-fatal anomalies found during the run, in the order they were found. */
    public List<String> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return String.format("NumtFinderResult{fragments=%d, blocks=%d, selfHits=%d, exclusions=%d, warnings=%d}",
                fragments.size(), blocks.size(), selfHits.size(), exclusions.size(), warnings.size());
    }
}
