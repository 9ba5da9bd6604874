package org.janelia.pixel.util;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Adjusts logback levels from code so that tests can see processor debug output
 * without editing logback-test.xml.
 *
 * @author Eric Trautman
 */
public class LogbackTestTools {

    public static void setLogLevelToDebug(final Class<?>... loggerClasses) {
        for (final Class<?> loggerClass : loggerClasses) {
            setLogLevel(loggerClass.getName(), Level.DEBUG);
        }
    }

    public static void setLogLevel(final String loggerName,
                                   final Level level) {
        final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        final Logger logger = loggerContext.getLogger(loggerName);
        logger.setLevel(level);
    }

    private LogbackTestTools() {
    }
}
