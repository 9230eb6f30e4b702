package org.broadinstitute.haplomix.utils;

import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.broadinstitute.haplomix.HaplomixBaseTest;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.Test;

public final class LoggingUtilsUnitTest extends HaplomixBaseTest {

    @AfterMethod
    public void restoreTestVerbosity() {
        LoggingUtils.setLoggingLevel(Log.LogLevel.WARNING);
    }

    @Test
    public void testLevelRoundTrip() {
        for (final Log.LogLevel level : Log.LogLevel.values()) {
            Assert.assertEquals(LoggingUtils.levelFromLog4jLevel(LoggingUtils.levelToLog4jLevel(level)), level);
        }
        Assert.assertEquals(LoggingUtils.levelToLog4jLevel(Log.LogLevel.WARNING), Level.WARN);
    }

    @Test
    public void testSetLoggingLevel() {
        LoggingUtils.setLoggingLevel(Log.LogLevel.DEBUG);
        Assert.assertTrue(LogManager.getLogger(LoggingUtilsUnitTest.class).isDebugEnabled());

        LoggingUtils.setLoggingLevel(Log.LogLevel.ERROR);
        Assert.assertFalse(LogManager.getLogger(LoggingUtilsUnitTest.class).isWarnEnabled());
        Assert.assertTrue(Log.isEnabled(Log.LogLevel.ERROR));
        Assert.assertFalse(Log.isEnabled(Log.LogLevel.INFO));
    }
}
