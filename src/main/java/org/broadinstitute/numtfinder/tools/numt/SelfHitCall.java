package org.broadinstitute.numtfinder.tools.numt;

import org.broadinstitute.numtfinder.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Self-hit assessment of one assembly sequence: how much of the reference its best fragments cover and how
 * similar they are.
 */
public final class SelfHitCall {

    private final String sequenceName;
    private final double coveragePercent;
    private final double identityPercent;
    private final List<Integer> contributingFragNums;
    private final List<Integer> extraFragNums;
    private final boolean excluded;

    public SelfHitCall(final String sequenceName, final double coveragePercent, final double identityPercent,
                       final List<Integer> contributingFragNums, final List<Integer> extraFragNums, final boolean excluded) {
        this.sequenceName = Utils.nonNull(sequenceName, "sequenceName");
        this.coveragePercent = coveragePercent;
        this.identityPercent = identityPercent;
        this.contributingFragNums = Collections.unmodifiableList(new ArrayList<>(Utils.nonNull(contributingFragNums)));
        this.extraFragNums = Collections.unmodifiableList(new ArrayList<>(Utils.nonNull(extraFragNums)));
        this.excluded = excluded;
    }

    public String getSequenceName() {
        return sequenceName;
    }

    public double getCoveragePercent() {
        return coveragePercent;
    }

    public double getIdentityPercent() {
        return identityPercent;
    }

    public List<Integer> getContributingFragNums() {
        return contributingFragNums;
    }

    /** Fragments of the sequence lying outside the assembly span of the contributing fragments. */
    public List<Integer> getExtraFragNums() {
        return extraFragNums;
    }

    public boolean hasExtraFragments() {
        return !extraFragNums.isEmpty();
    }

    public boolean isExcluded() {
        return excluded;
    }

    @Override
    public String toString() {
        return String.format("SelfHitCall{%s coverage=%.2f%% identity=%.2f%% contributing=%s extra=%s excluded=%s}",
                sequenceName, coveragePercent, identityPercent, contributingFragNums, extraFragNums, excluded);
    }
}
