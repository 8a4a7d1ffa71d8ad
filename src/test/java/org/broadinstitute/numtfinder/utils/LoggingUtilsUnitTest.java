package org.broadinstitute.numtfinder.utils;

import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.broadinstitute.numtfinder.testutils.NumtFinderBaseTest;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class LoggingUtilsUnitTest extends NumtFinderBaseTest {

    @DataProvider(name = "levels")
    public Object[][] levels() {
        return new Object[][]{
                {Log.LogLevel.ERROR, Level.ERROR},
                {Log.LogLevel.WARNING, Level.WARN},
                {Log.LogLevel.INFO, Level.INFO},
                {Log.LogLevel.DEBUG, Level.DEBUG},
        };
    }

    @Test(dataProvider = "levels")
    public void testVerbosityReachesLog4j(final Log.LogLevel verbosity, final Level expected) {
        Assert.assertEquals(LoggingUtils.levelToLog4jLevel(verbosity), expected);
        LoggingUtils.setLoggingLevel(verbosity);
        Assert.assertEquals(LogManager.getLogger(LoggingUtilsUnitTest.class).getLevel(), expected);
        Assert.assertTrue(Log.isEnabled(verbosity));
    }

    @AfterMethod
    public void restoreTestVerbosity() {
        LoggingUtils.setLoggingLevel(Log.LogLevel.WARNING);
    }
}
