package org.broadinstitute.haplomix.utils;

import com.google.common.collect.BiMap;
import com.google.common.collect.EnumHashBiMap;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.broadinstitute.haplomix.exceptions.HaplomixException;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Logger;

/**
 * Logging utilities.
 *
 * Haplomix tools use the htsjdk Log.LogLevel enum as the type for VERBOSITY command line arguments (each log4j
 * level is a static object, so there is no enum compatible with the command line argument framework).
 * We convert between that enum and the log4j and java.util.logging namespaces as necessary.
 */
public class LoggingUtils {

    private static final BiMap<Log.LogLevel, Level> loggingLevelNamespaceMap;
    static {
        loggingLevelNamespaceMap = EnumHashBiMap.create(Log.LogLevel.class);
        loggingLevelNamespaceMap.put(Log.LogLevel.ERROR, Level.ERROR);
        loggingLevelNamespaceMap.put(Log.LogLevel.WARNING, Level.WARN);
        loggingLevelNamespaceMap.put(Log.LogLevel.INFO, Level.INFO);
        loggingLevelNamespaceMap.put(Log.LogLevel.DEBUG, Level.DEBUG);
    }

    private static final BiMap<Log.LogLevel, java.util.logging.Level> javaUtilLevelNamespaceMap;
    static {
        javaUtilLevelNamespaceMap = EnumHashBiMap.create(Log.LogLevel.class);
        javaUtilLevelNamespaceMap.put(Log.LogLevel.ERROR, java.util.logging.Level.SEVERE);
        javaUtilLevelNamespaceMap.put(Log.LogLevel.WARNING, java.util.logging.Level.WARNING);
        javaUtilLevelNamespaceMap.put(Log.LogLevel.INFO, java.util.logging.Level.INFO);
        javaUtilLevelNamespaceMap.put(Log.LogLevel.DEBUG, java.util.logging.Level.FINEST);
    }

    // Package-private for unit test access
    static Log.LogLevel levelFromLog4jLevel(final Level log4jLevel) {
        return loggingLevelNamespaceMap.inverse().get(log4jLevel);
    }

    /**
     * Converts an htsjdk log level to a log4j log level.
     */
    public static Level levelToLog4jLevel(final Log.LogLevel verbosity) {
        final Level level = loggingLevelNamespaceMap.get(verbosity);
        if (level == null) {
            throw new HaplomixException("This log level is not implemented properly: " + verbosity);
        }
        return level;
    }

    /**
     * Propagate the verbosity level to htsjdk, log4j and the java built in logger.
     */
    public static void setLoggingLevel(final Log.LogLevel verbosity) {
        Utils.nonNull(verbosity);
        Log.setGlobalLogLevel(verbosity);
        setLog4JLoggingLevel(verbosity);
        setJavaUtilLoggingLevel(verbosity);
    }

    private static void setLog4JLoggingLevel(final Log.LogLevel verbosity) {
        // propagate to the logger config that governs our package
        final LoggerContext loggerContext = (LoggerContext) LogManager.getContext(false);
        final Configuration loggerContextConfig = loggerContext.getConfiguration();
        final LoggerConfig loggerConfig = loggerContextConfig.getLoggerConfig(LoggingUtils.class.getName());

        loggerConfig.setLevel(levelToLog4jLevel(verbosity));
        loggerContext.updateLoggers();
    }

    private static void setJavaUtilLoggingLevel(final Log.LogLevel verbosity) {
        final Logger topLogger = java.util.logging.Logger.getLogger("");

        Handler consoleHandler = null;
        for (final Handler handler : topLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                consoleHandler = handler;
                break;
            }
        }

        if (consoleHandler == null) {
            consoleHandler = new ConsoleHandler();
            topLogger.addHandler(consoleHandler);
        }
        consoleHandler.setLevel(javaUtilLevelNamespaceMap.get(verbosity));
    }
}
