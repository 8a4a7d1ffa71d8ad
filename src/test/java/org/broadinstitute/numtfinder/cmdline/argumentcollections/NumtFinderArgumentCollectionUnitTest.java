package org.broadinstitute.numtfinder.cmdline.argumentcollections;

import org.broadinstitute.numtfinder.testutils.NumtFinderBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.function.Consumer;

public final class NumtFinderArgumentCollectionUnitTest extends NumtFinderBaseTest {

    @Test
    public void testDefaults() {
        final NumtFinderArgumentCollection arguments = new NumtFinderArgumentCollection();
        arguments.validate();
        Assert.assertTrue(arguments.circular);
        Assert.assertEquals(arguments.fragmentMerge, 8000);
        Assert.assertFalse(arguments.stranded);
        Assert.assertEquals(arguments.minFragmentLength, 0);
        Assert.assertEquals(arguments.selfHitCoverage, 99.0);
        Assert.assertEquals(arguments.selfHitIdentity, 99.0);
        Assert.assertTrue(arguments.autoExclude);
        Assert.assertTrue(arguments.exclude.isEmpty());
    }

    @DataProvider(name = "invalidArguments")
    public Object[][] invalidArguments() {
        return new Object[][]{
                {(Consumer<NumtFinderArgumentCollection>) a -> a.fragmentMerge = -1},
                {(Consumer<NumtFinderArgumentCollection>) a -> a.minFragmentLength = -5},
                {(Consumer<NumtFinderArgumentCollection>) a -> a.selfHitCoverage = 100.5},
                {(Consumer<NumtFinderArgumentCollection>) a -> a.selfHitIdentity = -0.1},
                {(Consumer<NumtFinderArgumentCollection>) a -> a.exclude.add("")},
        };
    }

    @Test(dataProvider = "invalidArguments", expectedExceptions = IllegalArgumentException.class)
    public void testInvalidArguments(final Consumer<NumtFinderArgumentCollection> change) {
        final NumtFinderArgumentCollection arguments = new NumtFinderArgumentCollection();
        change.accept(arguments);
        arguments.validate();
    }

    @Test
    public void testThresholdBoundsAreInclusive() {
        final NumtFinderArgumentCollection arguments = new NumtFinderArgumentCollection();
        arguments.selfHitCoverage = 100.0;
        arguments.selfHitIdentity = 0.0;
        arguments.fragmentMerge = 0;
        arguments.validate();
    }
}
