// SPDX-License-Identifier: Apache-2.0
package org.blobsync.tools.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Single line console formatter with ANSI colors per level.
 */
public class CleanColorfulFormatter extends Formatter {
    public static final String RESET = "\u001B[0m";
    public static final String RED = "\u001B[31m";
    public static final String YELLOW = "\u001B[33m";
    public static final String LIGHT_GREEN = "\u001B[92m";
    public static final String GREY = "\u001B[90m";
    public static final String WHITE = "\u001B[37m";

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

    /**
     * Install this formatter on every console handler of the root logger.
     */
    public static void makeLoggingColorful() {
        final Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setFormatter(new CleanColorfulFormatter());
            }
        }
    }

    @Override
    public String format(LogRecord record) {
        final StringBuilder sb = new StringBuilder();
        sb.append(GREY).append(TIME_FORMAT.format(record.getInstant())).append(' ');
        sb.append(levelColor(record.getLevel()))
                .append(String.format("%-7s", record.getLevel().getName()))
                .append(RESET)
                .append(' ');
        sb.append(GREY).append('[').append(source(record)).append("] ").append(RESET);
        sb.append(formatMessage(record)).append(RESET).append(System.lineSeparator());
        if (record.getThrown() != null) {
            final StringWriter stackTrace = new StringWriter();
            record.getThrown().printStackTrace(new PrintWriter(stackTrace));
            sb.append(RED).append(stackTrace).append(RESET);
        }
        return sb.toString();
    }

    private static String source(LogRecord record) {
        if (record.getSourceClassName() == null) {
            return record.getLoggerName();
        }
        final String className = record.getSourceClassName();
        final String simpleName = className.substring(className.lastIndexOf('.') + 1);
        return record.getSourceMethodName() == null ? simpleName : simpleName + "#" + record.getSourceMethodName();
    }

    private static String levelColor(Level level) {
        if (level.intValue() >= Level.SEVERE.intValue()) {
            return RED;
        } else if (level.intValue() >= Level.WARNING.intValue()) {
            return YELLOW;
        } else if (level.intValue() >= Level.INFO.intValue()) {
            return LIGHT_GREEN;
        }
        return WHITE;
    }
}
