package org.broadinstitute.numtfinder.cmdline.argumentcollections;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.numtfinder.utils.Utils;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Options controlling how alignment hits become NUMT fragments and blocks.
 */
public class NumtFinderArgumentCollection implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String CIRCULAR_LONG_NAME = "circular";
    public static final String FRAGMENT_MERGE_LONG_NAME = "fragment-merge";
    public static final String STRANDED_LONG_NAME = "stranded";
    public static final String MIN_FRAGMENT_LENGTH_LONG_NAME = "min-fragment-length";
    public static final String SELF_HIT_COVERAGE_LONG_NAME = "self-hit-coverage";
    public static final String SELF_HIT_IDENTITY_LONG_NAME = "self-hit-identity";
    public static final String AUTO_EXCLUDE_LONG_NAME = "auto-exclude";
    public static final String EXCLUDE_LONG_NAME = "exclude";

    public static final int DEFAULT_FRAGMENT_MERGE = 8000;
    public static final double DEFAULT_SELF_HIT_THRESHOLD = 99.0;

    @Argument(fullName = CIRCULAR_LONG_NAME,
            doc = "Whether the mitochondrial reference is circular. A circular reference is searched as a doubled sequence " +
                    "and hits are projected back onto the true coordinates.",
            optional = true)
    public boolean circular = true;

    @Argument(fullName = FRAGMENT_MERGE_LONG_NAME,
            doc = "Maximum distance (bp) between the end of a NUMT block and the start of the next fragment for them to merge.",
            minValue = 0,
            optional = true)
    public int fragmentMerge = DEFAULT_FRAGMENT_MERGE;

    @Argument(fullName = STRANDED_LONG_NAME,
            doc = "Only merge fragments on the same strand into a block.",
            optional = true)
    public boolean stranded = false;

    @Argument(fullName = MIN_FRAGMENT_LENGTH_LONG_NAME,
            doc = "Minimum alignment length of a hit for it to be considered as a NUMT fragment.",
            minValue = 0,
            optional = true)
    public int minFragmentLength = 0;

    @Argument(fullName = SELF_HIT_COVERAGE_LONG_NAME,
            doc = "Percentage of the mitochondrial reference a sequence must cover to be called a self-hit.",
            minValue = 0.0, maxValue = 100.0,
            optional = true)
    public double selfHitCoverage = DEFAULT_SELF_HIT_THRESHOLD;

    @Argument(fullName = SELF_HIT_IDENTITY_LONG_NAME,
            doc = "Percent identity a sequence must reach over its covering fragments to be called a self-hit.",
            minValue = 0.0, maxValue = 100.0,
            optional = true)
    public double selfHitIdentity = DEFAULT_SELF_HIT_THRESHOLD;

    @Argument(fullName = AUTO_EXCLUDE_LONG_NAME,
            doc = "Exclude self-hit sequences from the fragment, block and coverage output. When false they are only reported.",
            optional = true)
    public boolean autoExclude = true;

    @Argument(fullName = EXCLUDE_LONG_NAME,
            doc = "Assembly sequence to exclude from the output. May be given several times. A .list file is expanded by the " +
                    "argument parser; any other existing file, such as a previous exclude.txt, is read as one id per line.",
            optional = true)
    public List<String> exclude = new ArrayList<>();

    /**
     * Checks the values for combinations the parser cannot catch by itself.
     *
     * @throws IllegalArgumentException if any value is out of range
     */
    public void validate() {
        Utils.validateArg(fragmentMerge >= 0, () -> FRAGMENT_MERGE_LONG_NAME + " must not be negative but was " + fragmentMerge);
        Utils.validateArg(minFragmentLength >= 0, () -> MIN_FRAGMENT_LENGTH_LONG_NAME + " must not be negative but was " + minFragmentLength);
        Utils.validateArg(selfHitCoverage >= 0 && selfHitCoverage <= 100,
                () -> SELF_HIT_COVERAGE_LONG_NAME + " must be between 0 and 100 but was " + selfHitCoverage);
        Utils.validateArg(selfHitIdentity >= 0 && selfHitIdentity <= 100,
                () -> SELF_HIT_IDENTITY_LONG_NAME + " must be between 0 and 100 but was " + selfHitIdentity);
        Utils.nonNull(exclude, EXCLUDE_LONG_NAME);
        exclude.forEach(id -> Utils.nonEmpty(id, EXCLUDE_LONG_NAME + " ids must not be empty"));
    }
}
