package org.broadinstitute.numtfinder.tools.numt.io;

import org.broadinstitute.numtfinder.utils.tsv.TableColumnCollection;

/**
 * Column names of the tables read and written by NUMTFinder.
 */
public final class NumtTableColumns {

    public static final String FRAG_NUM = "FragNum";
    public static final String SEQ_NAME = "SeqName";
    public static final String START = "Start";
    public static final String END = "End";
    public static final String STRAND = "Strand";
    public static final String BIT_SCORE = "BitScore";
    public static final String EXPECT = "Expect";
    public static final String LENGTH = "Length";
    public static final String IDENTITY = "Identity";
    public static final String MT_START = "mtStart";
    public static final String MT_END = "mtEnd";
    public static final String MT_FRAG = "mtFrag";
    public static final String FRAG_LEN = "FragLen";
    public static final String FRAG_GAPS = "FragGaps";
    public static final String LOCUS = "Locus";
    public static final String POS = "Pos";
    public static final String DEPTH = "X";
    public static final String COVERED = "Covered";
    public static final String COVERAGE = "Coverage";
    public static final String MEAN_DEPTH = "MeanX";
    public static final String MEDIAN_DEPTH = "MedianX";
    public static final String MAX_DEPTH = "MaxX";
    public static final String CONTRIBUTING = "Contributing";
    public static final String EXTRA = "Extra";
    public static final String EXCLUDED = "Excluded";

    /** Hit table columns that must be present; {@value #STRAND} is optional. */
    public static final TableColumnCollection MANDATORY_HIT_COLUMNS = new TableColumnCollection(
            SEQ_NAME, START, END, BIT_SCORE, EXPECT, LENGTH, IDENTITY, MT_START, MT_END);

    public static final TableColumnCollection HIT_COLUMNS = new TableColumnCollection(
            SEQ_NAME, START, END, STRAND, BIT_SCORE, EXPECT, LENGTH, IDENTITY, MT_START, MT_END);

    public static final TableColumnCollection FRAGMENT_COLUMNS = new TableColumnCollection(
            FRAG_NUM, SEQ_NAME, START, END, STRAND, BIT_SCORE, EXPECT, LENGTH, IDENTITY, MT_START, MT_END);

    public static final TableColumnCollection BLOCK_COLUMNS = new TableColumnCollection(
            SEQ_NAME, START, END, STRAND, BIT_SCORE, EXPECT, LENGTH, IDENTITY, MT_FRAG, FRAG_NUM, FRAG_LEN, FRAG_GAPS);

    public static final TableColumnCollection DEPTH_COLUMNS = new TableColumnCollection(LOCUS, POS, DEPTH);

    public static final TableColumnCollection COVERAGE_COLUMNS = new TableColumnCollection(
            LOCUS, LENGTH, COVERED, COVERAGE, MEAN_DEPTH, MEDIAN_DEPTH, MAX_DEPTH);

    public static final TableColumnCollection SELF_HIT_COLUMNS = new TableColumnCollection(
            SEQ_NAME, COVERAGE, IDENTITY, CONTRIBUTING, EXTRA, EXCLUDED);

    /** Written in list columns that have no values. */
    public static final String EMPTY_LIST = "-";

    /**
     * Formats scores the way the aligner reports them: integral values without a decimal part.
     */
    public static String formatScore(final double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private NumtTableColumns() {}
}
