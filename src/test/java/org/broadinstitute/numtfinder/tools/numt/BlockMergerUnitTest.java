package org.broadinstitute.numtfinder.tools.numt;

import org.broadinstitute.numtfinder.testutils.NumtFinderBaseTest;
import org.broadinstitute.numtfinder.utils.SimpleInterval;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.broadinstitute.numtfinder.tools.numt.NumtTestUtils.fragment;

public final class BlockMergerUnitTest extends NumtFinderBaseTest {

    @Test
    public void testNearbyFragmentsMerge() {
        final NumtFragment first = fragment(1, "chr1", 100, 200, Strand.PLUS, 95, 101, 201);
        final NumtFragment second = fragment(2, "chr1", 205, 300, Strand.PLUS, 90, 202, 297);
        final List<NumtBlock> blocks = new BlockMerger(8000, false).merge(Arrays.asList(second, first));
        Assert.assertEquals(blocks.size(), 1);
        final NumtBlock block = blocks.get(0);
        Assert.assertEquals(block.getInterval(), new SimpleInterval("chr1", 100, 300));
        Assert.assertEquals(block.getStrand(), BlockStrand.PLUS);
        Assert.assertEquals(block.getFragNums(), Arrays.asList(1, 2));
        Assert.assertEquals(block.getMtFrag(), "1|2");
        Assert.assertEquals(block.getFragCount(), 2);
        Assert.assertEquals(block.getFragGaps(), 4);
        Assert.assertEquals(block.getFragLen(), 197);
        Assert.assertEquals(block.getFragLen() + block.getFragGaps(), 300 - 100 + 1);
        Assert.assertEquals(block.getLength(), 101 + 96);
        Assert.assertEquals(block.getIdentity(), 95 + 90);
        Assert.assertEquals(block.getBitScore(), first.getBitScore() + second.getBitScore(), 1e-9);
        Assert.assertEquals(block.getExpect(), Math.min(first.getExpect(), second.getExpect()), 0.0);
    }

    @DataProvider(name = "distances")
    public Object[][] distances() {
        // gap between the fragments is 205 - 200 = 5
        return new Object[][]{
                {0, 2},
                {4, 2},
                {5, 1},
                {8000, 1},
        };
    }

    @Test(dataProvider = "distances")
    public void testMergeDistance(final int distance, final int expectedBlocks) {
        final List<NumtFragment> fragments = Arrays.asList(
                fragment(1, "chr1", 100, 200, Strand.PLUS),
                fragment(2, "chr1", 205, 300, Strand.PLUS));
        Assert.assertEquals(new BlockMerger(distance, false).merge(fragments).size(), expectedBlocks);
    }

    @Test
    public void testAdjacentFragments() {
        final List<NumtFragment> fragments = Arrays.asList(
                fragment(1, "chr1", 100, 200, Strand.PLUS),
                fragment(2, "chr1", 201, 300, Strand.PLUS));
        Assert.assertEquals(new BlockMerger(0, false).merge(fragments).size(), 2);
        final List<NumtBlock> blocks = new BlockMerger(1, false).merge(fragments);
        Assert.assertEquals(blocks.size(), 1);
        Assert.assertEquals(blocks.get(0).getFragGaps(), 0);
    }

    @Test
    public void testSequencesNeverMerge() {
        final List<NumtBlock> blocks = new BlockMerger(1_000_000, false).merge(Arrays.asList(
                fragment(1, "chr1", 100, 200, Strand.PLUS),
                fragment(2, "chr2", 100, 200, Strand.PLUS)));
        Assert.assertEquals(blocks.size(), 2);
    }

    @Test
    public void testStrandGating() {
        final List<NumtFragment> fragments = Arrays.asList(
                fragment(1, "chr1", 100, 200, Strand.PLUS),
                fragment(2, "chr1", 300, 400, Strand.MINUS),
                fragment(3, "chr1", 500, 600, Strand.MINUS));

        final List<NumtBlock> unstranded = new BlockMerger(8000, false).merge(fragments);
        Assert.assertEquals(unstranded.size(), 1);
        Assert.assertEquals(unstranded.get(0).getStrand(), BlockStrand.MIXED);
        Assert.assertEquals(unstranded.get(0).getStrand().getSymbol(), "+/-");

        final List<NumtBlock> stranded = new BlockMerger(8000, true).merge(fragments);
        Assert.assertEquals(stranded.size(), 2);
        Assert.assertEquals(stranded.get(0).getStrand(), BlockStrand.PLUS);
        Assert.assertEquals(stranded.get(1).getStrand(), BlockStrand.MINUS);
        Assert.assertEquals(stranded.get(1).getMtFrag(), "2|3");
        for (final NumtBlock block : stranded) {
            Assert.assertNotEquals(block.getStrand(), BlockStrand.MIXED);
        }
    }

    @DataProvider(name = "strandedness")
    public Object[][] strandedness() {
        return new Object[][]{{false}, {true}};
    }

    @Test(dataProvider = "strandedness")
    public void testBlocksOnlyGrowWithDistance(final boolean stranded) {
        final Random random = new Random(7);
        final List<NumtFragment> fragments = new ArrayList<>();
        int position = 1;
        for (int i = 1; i <= 200; i++) {
            position += random.nextInt(20_000);
            final int length = 50 + random.nextInt(500);
            fragments.add(fragment(i, "chr" + (1 + random.nextInt(3)), position, position + length - 1,
                    random.nextBoolean() ? Strand.PLUS : Strand.MINUS));
            position += length;
        }
        List<NumtBlock> previous = null;
        int previousDistance = -1;
        for (final int distance : new int[]{0, 100, 1000, 5000, 8000, 20_000, 1_000_000}) {
            final List<NumtBlock> blocks = new BlockMerger(distance, stranded).merge(fragments);
            Assert.assertEquals(blocks.stream().mapToInt(NumtBlock::getFragCount).sum(), fragments.size());
            if (previous != null) {
                for (final NumtBlock smaller : previous) {
                    assertInsideOneBlock(smaller, blocks, previousDistance, distance);
                }
                Assert.assertTrue(blocks.size() <= previous.size());
            }
            previous = blocks;
            previousDistance = distance;
        }
    }

    private static void assertInsideOneBlock(final NumtBlock smaller, final List<NumtBlock> blocks,
                                             final int smallerDistance, final int largerDistance) {
        final List<NumtBlock> holders = new ArrayList<>();
        for (final NumtBlock block : blocks) {
            if (block.getFragNums().contains(smaller.getFragNums().get(0))) {
                holders.add(block);
            }
        }
        Assert.assertEquals(holders.size(), 1);
        final NumtBlock holder = holders.get(0);
        final String description = String.format("block %s at %d bp is not inside %s at %d bp",
                smaller.getMtFrag(), smallerDistance, holder.getMtFrag(), largerDistance);
        Assert.assertTrue(holder.getFragNums().containsAll(smaller.getFragNums()), description);
        Assert.assertEquals(holder.getContig(), smaller.getContig(), description);
        Assert.assertTrue(holder.getStart() <= smaller.getStart() && smaller.getEnd() <= holder.getEnd(), description);
    }

    @Test
    public void testNoFragments() {
        Assert.assertEquals(new BlockMerger(8000, false).merge(Collections.emptyList()), Collections.emptyList());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNegativeDistance() {
        new BlockMerger(-1, false);
    }
}
