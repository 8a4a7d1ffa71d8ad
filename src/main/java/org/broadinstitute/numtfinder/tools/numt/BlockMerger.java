package org.broadinstitute.numtfinder.tools.numt;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.numtfinder.utils.LocatableComparator;
import org.broadinstitute.numtfinder.utils.SimpleInterval;
import org.broadinstitute.numtfinder.utils.Utils;
import org.broadinstitute.numtfinder.utils.param.ParamUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Merges fragments into NUMT blocks in a single sweep along each assembly sequence.
 * <p>
 * A fragment joins the open block when it is on the same sequence, starts no more than the merge distance
 * past the block end and, in stranded mode, has the block's strand. Otherwise the open block is closed and the
 * fragment seeds a new one. Blocks may therefore contain duplications, rearrangements and, unless stranded,
 * inversions.
 * </p>
 */
public final class BlockMerger {
    private static final Logger logger = LogManager.getLogger(BlockMerger.class);

    private static final Comparator<NumtFragment> FRAGMENT_ORDER =
            Comparator.<NumtFragment, NumtFragment>comparing(f -> f, LocatableComparator.INSTANCE)
                    .thenComparingInt(NumtFragment::getFragNum);

    private final int mergeDistance;
    private final boolean stranded;

    /**
     * @param mergeDistance largest distance between a block end and the next fragment start for them to merge
     * @param stranded whether only fragments on the same strand may merge
     */
    public BlockMerger(final int mergeDistance, final boolean stranded) {
        this.mergeDistance = ParamUtils.isNonNegative(mergeDistance, "Merge distance must not be negative: " + mergeDistance);
        this.stranded = stranded;
    }

    public List<NumtBlock> merge(final List<NumtFragment> fragments) {
        Utils.nonNull(fragments, "fragments");
        final List<NumtFragment> ordered = new ArrayList<>(fragments);
        ordered.sort(FRAGMENT_ORDER);

        final List<NumtBlock> blocks = new ArrayList<>();
        OpenBlock open = null;
        for (final NumtFragment fragment : ordered) {
            if (open != null && open.accepts(fragment)) {
                open.add(fragment);
            } else {
                if (open != null) {
                    blocks.add(open.build());
                }
                open = new OpenBlock(fragment);
            }
        }
        if (open != null) {
            blocks.add(open.build());
        }
        logger.info(String.format("Merged %d fragments within %d bp%s into %d blocks",
                fragments.size(), mergeDistance, stranded ? " (stranded)" : "", blocks.size()));
        return blocks;
    }

    /**
     * Running aggregates of the block being built.
     */
    private final class OpenBlock {
        private final String contig;
        private final int start;
        private int end;
        private BlockStrand strand;
        private final List<Integer> fragNums = new ArrayList<>();
        private long fragLen;
        private long fragGaps;
        private double bitScore;
        private double expect;
        private long length;
        private long identity;

        OpenBlock(final NumtFragment seed) {
            contig = seed.getContig();
            start = seed.getStart();
            end = seed.getEnd();
            strand = BlockStrand.of(seed.getStrand());
            fragNums.add(seed.getFragNum());
            fragLen = seed.getSpan();
            bitScore = seed.getBitScore();
            expect = seed.getExpect();
            length = seed.getAlignedLength();
            identity = seed.getIdentity();
        }

        boolean accepts(final NumtFragment fragment) {
            return contig.equals(fragment.getContig())
                    && (long) fragment.getStart() - end <= mergeDistance
                    && (!stranded || strand.matches(fragment.getStrand()));
        }

        void add(final NumtFragment fragment) {
            fragGaps += (long) fragment.getStart() - end - 1;
            end = Math.max(end, fragment.getEnd());
            strand = strand.combine(fragment.getStrand());
            fragNums.add(fragment.getFragNum());
            fragLen += fragment.getSpan();
            bitScore += fragment.getBitScore();
            expect = Math.min(expect, fragment.getExpect());
            length += fragment.getAlignedLength();
            identity += fragment.getIdentity();
        }

        NumtBlock build() {
            return new NumtBlock(new SimpleInterval(contig, start, end), strand, fragNums, fragLen, fragGaps,
                    bitScore, expect, length, identity);
        }
    }
}
