package org.broadinstitute.numtfinder.tools.numt;

import org.broadinstitute.numtfinder.cmdline.argumentcollections.NumtFinderArgumentCollection;
import org.broadinstitute.numtfinder.testutils.NumtFinderBaseTest;
import org.broadinstitute.numtfinder.utils.SimpleInterval;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.broadinstitute.numtfinder.tools.numt.NumtTestUtils.hit;

public final class NumtFinderEngineUnitTest extends NumtFinderBaseTest {

    private static final CircularCoordinates COORDINATES = new CircularCoordinates(1000, true);

    private static List<AlignmentHit> hits() {
        return Arrays.asList(
                hit("scaffold1", 100, 200, Strand.PLUS, 95, 101, 201),
                hit("scaffold1", 205, 300, Strand.PLUS, 90, 202, 297),
                hit("scaffold1", 150, 250, Strand.PLUS, 60, 500, 600),
                hit("scaffold1", 1000, 1050, Strand.MINUS, 48, 980, 1030),
                hit("scaffold2", 300, 400, Strand.PLUS, 100, 1401, 1501),
                hit("mitoContig", 1, 600, Strand.PLUS, 598, 1, 600),
                hit("mitoContig", 601, 1000, Strand.PLUS, 399, 601, 1000));
    }

    private static NumtFinderResult run(final NumtFinderArgumentCollection arguments, final List<String> exclusions) {
        return new NumtFinderEngine(arguments, new CircularCoordinates(1000, arguments.circular), "chrM").run(hits(), exclusions);
    }

    @Test
    public void testDefaults() {
        final NumtFinderResult result = run(new NumtFinderArgumentCollection(), Collections.emptyList());

        final List<Integer> fragNums = result.getFragments().stream().map(NumtFragment::getFragNum).collect(Collectors.toList());
        Assert.assertEquals(fragNums, Arrays.asList(3, 4, 5, 6));
        final NumtFragment wrapped = result.getFragments().get(2);
        Assert.assertEquals(wrapped.getReference(), new ReferenceInterval(980, 30, CoordinateSpace.TRUE));

        Assert.assertEquals(result.getSelfHits().size(), 1);
        Assert.assertEquals(result.getSelfHits().get(0).getSequenceName(), "mitoContig");
        Assert.assertEquals(result.getSelfHits().get(0).getContributingFragNums(), Arrays.asList(1, 2));
        Assert.assertEquals(result.getExclusions(), Collections.singleton("mitoContig"));

        Assert.assertEquals(result.getBlocks().size(), 2);
        final NumtBlock scaffold1 = result.getBlocks().get(0);
        Assert.assertEquals(scaffold1.getInterval(), new SimpleInterval("scaffold1", 100, 1050));
        Assert.assertEquals(scaffold1.getStrand(), BlockStrand.MIXED);
        Assert.assertEquals(scaffold1.getMtFrag(), "3|4|5");
        Assert.assertEquals(scaffold1.getFragLen(), 248);
        Assert.assertEquals(scaffold1.getFragGaps(), 703);
        Assert.assertEquals(scaffold1.getIdentity(), 95 + 90 + 48);
        final NumtBlock scaffold2 = result.getBlocks().get(1);
        Assert.assertEquals(scaffold2.getInterval(), new SimpleInterval("scaffold2", 300, 400));
        Assert.assertEquals(scaffold2.getMtFrag(), "6");

        final CoverageProfile coverage = result.getCoverage();
        Assert.assertEquals(coverage.getLocus(), "chrM");
        Assert.assertEquals(coverage.getCoveredBases(), 101 + 96 + 51 + 101);
        Assert.assertEquals(coverage.getMaxDepth(), 1);

        // a fragment spans the origin and a block mixes strands
        Assert.assertEquals(result.getWarnings().size(), 2);
    }

    @Test
    public void testStranded() {
        final NumtFinderArgumentCollection arguments = new NumtFinderArgumentCollection();
        arguments.stranded = true;
        final NumtFinderResult result = run(arguments, Collections.emptyList());
        Assert.assertEquals(result.getBlocks().stream().map(NumtBlock::getMtFrag).collect(Collectors.toList()),
                Arrays.asList("3|4", "5", "6"));
        Assert.assertTrue(result.getBlocks().stream().noneMatch(b -> b.getStrand() == BlockStrand.MIXED));
    }

    @Test
    public void testSelfHitsReportedOnly() {
        final NumtFinderArgumentCollection arguments = new NumtFinderArgumentCollection();
        arguments.autoExclude = false;
        final NumtFinderResult result = run(arguments, Collections.emptyList());
        Assert.assertEquals(result.getFragments().size(), 6);
        Assert.assertTrue(result.getExclusions().isEmpty());
        Assert.assertFalse(result.getSelfHits().get(0).isExcluded());
        Assert.assertEquals(result.getCoverage().getCoveredBases(), 1000);
    }

    @Test
    public void testExplicitExclusion() {
        final NumtFinderResult result = run(new NumtFinderArgumentCollection(), Collections.singletonList("scaffold2"));
        Assert.assertEquals(result.getExclusions().toArray(), new Object[]{"scaffold2", "mitoContig"});
        Assert.assertEquals(result.getBlocks().size(), 1);
        Assert.assertTrue(result.getFragments().stream().noneMatch(f -> f.getContig().equals("scaffold2")));
    }

    @Test
    public void testMinimumFragmentLength() {
        final NumtFinderArgumentCollection arguments = new NumtFinderArgumentCollection();
        arguments.minFragmentLength = 100;
        final NumtFinderResult result = run(arguments, Collections.emptyList());
        // the 96 and 51 bp hits are filtered out before the 101 bp overlapping hit loses to the better one
        Assert.assertEquals(result.getFragments().stream()
                .filter(f -> f.getContig().equals("scaffold1"))
                .map(NumtFragment::getStart)
                .collect(Collectors.toList()), Collections.singletonList(100));
        Assert.assertEquals(result.getBlocks().get(0).getStrand(), BlockStrand.PLUS);
    }

    @Test
    public void testLengthFilterCanEmptyASequence() {
        final NumtFinderArgumentCollection arguments = new NumtFinderArgumentCollection();
        arguments.minFragmentLength = 102;
        final NumtFinderResult result = run(arguments, Collections.emptyList());
        Assert.assertTrue(result.getWarnings().stream().anyMatch(w -> w.contains("scaffold1")));
        Assert.assertTrue(result.getWarnings().stream().anyMatch(w -> w.contains("scaffold2")));
    }

    @Test
    public void testNothingLeft() {
        final NumtFinderResult result = new NumtFinderEngine(new NumtFinderArgumentCollection(), COORDINATES, "chrM")
                .run(Collections.emptyList(), Collections.emptyList());
        Assert.assertTrue(result.getFragments().isEmpty());
        Assert.assertTrue(result.getBlocks().isEmpty());
        Assert.assertEquals(result.getCoverage().getCoveredBases(), 0);
        Assert.assertEquals(result.getWarnings().size(), 1);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testCircularityMismatch() {
        new NumtFinderEngine(new NumtFinderArgumentCollection(), new CircularCoordinates(1000, false), "chrM");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInvalidArguments() {
        final NumtFinderArgumentCollection arguments = new NumtFinderArgumentCollection();
        arguments.selfHitIdentity = 120;
        new NumtFinderEngine(arguments, COORDINATES, "chrM");
    }
}
