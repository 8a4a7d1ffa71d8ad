package org.broadinstitute.numtfinder.tools.numt;

import org.broadinstitute.numtfinder.testutils.NumtFinderBaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.broadinstitute.numtfinder.tools.numt.NumtTestUtils.fragment;

public final class CoverageAggregatorUnitTest extends NumtFinderBaseTest {

    private static final CircularCoordinates COORDINATES = new CircularCoordinates(1000, true);

    @Test
    public void testWrappedFragmentCoversBothEnds() {
        final NumtFragment wrapped = fragment(1, "chr1", 1000, 1050, Strand.MINUS, 48, 980, 30);
        final CoverageProfile profile = new CoverageAggregator(COORDINATES).aggregate("chrM", Collections.singletonList(wrapped));
        Assert.assertEquals(profile.getLocus(), "chrM");
        Assert.assertEquals(profile.getLength(), 1000);
        Assert.assertEquals(profile.getCoveredBases(), 51);
        Assert.assertEquals(profile.getTotalDepth(), COORDINATES.referenceLength(wrapped.getReference()));
        Assert.assertEquals(profile.getDepth(1), 1);
        Assert.assertEquals(profile.getDepth(30), 1);
        Assert.assertEquals(profile.getDepth(31), 0);
        Assert.assertEquals(profile.getDepth(979), 0);
        Assert.assertEquals(profile.getDepth(980), 1);
        Assert.assertEquals(profile.getDepth(1000), 1);
    }

    @Test
    public void testOverlappingFragmentsStack() {
        final CoverageProfile profile = new CoverageAggregator(COORDINATES).aggregate("chrM", Arrays.asList(
                fragment(1, "chr1", 1, 100, Strand.PLUS, 90, 1, 100),
                fragment(2, "chr2", 1, 100, Strand.PLUS, 90, 51, 150),
                fragment(3, "chr3", 1, 10, Strand.PLUS, 10, 60, 69)));
        Assert.assertEquals(profile.getDepth(50), 1);
        Assert.assertEquals(profile.getDepth(55), 2);
        Assert.assertEquals(profile.getDepth(65), 3);
        Assert.assertEquals(profile.getDepth(150), 1);
        Assert.assertEquals(profile.getDepth(151), 0);
        Assert.assertEquals(profile.getMaxDepth(), 3);
        Assert.assertEquals(profile.getCoveredBases(), 150);
        Assert.assertEquals(profile.getTotalDepth(), 100 + 100 + 10);
        Assert.assertEquals(profile.getMeanDepth(), 0.21, 1e-9);
        Assert.assertEquals(profile.getMedianDepth(), 0.0, 0.0);
        Assert.assertEquals(profile.getCoveredPercent(), 15.0, 1e-9);
    }

    @Test
    public void testNoFragments() {
        final CoverageProfile profile = new CoverageAggregator(COORDINATES).aggregate("chrM", Collections.emptyList());
        Assert.assertEquals(profile.getCoveredBases(), 0);
        Assert.assertEquals(profile.getMaxDepth(), 0);
        Assert.assertEquals(profile.getDepths().length, 1000);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testPositionOutsideTheReference() {
        new CoverageAggregator(COORDINATES).aggregate("chrM", Collections.emptyList()).getDepth(1001);
    }
}
