package com.tyron.keystone.testFramework;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Console output for the {@code com.tyron.keystone} loggers during tests.
 * <p>
 * The threshold comes from {@code -Dkeystone.test.logLevel=WARNING|INFO|FINE|...}. Many tests
 * provoke failures on purpose, so exceptions are printed as a one-line cause chain unless
 * FINE or lower is requested.
 */
public final class TestLogging {

    public static final String LEVEL_PROPERTY = "keystone.test.logLevel";

    private static final String KEYSTONE_LOGGER = "com.tyron.keystone";

    private static volatile boolean configured;

    // LogManager only holds loggers weakly; the handler must outlive this method.
    private static Logger keystoneLogger;

    private TestLogging() {
    }

    public static synchronized void configureOnce() {
        if (configured) return;
        configured = true;

        Level level = parseLevel(System.getProperty(LEVEL_PROPERTY, "INFO"));
        boolean fullTraces = level.intValue() <= Level.FINE.intValue();

        Handler console = new ConsoleHandler();
        console.setLevel(level);
        console.setFormatter(new KeystoneTestFormatter(fullTraces));

        // Captures attach to this logger with Level.ALL, so the console handler does the filtering.
        keystoneLogger = Logger.getLogger(KEYSTONE_LOGGER);
        keystoneLogger.setUseParentHandlers(false);
        keystoneLogger.addHandler(console);
    }

    static Level parseLevel(String raw) {
        if (raw == null) return Level.INFO;
        try {
            return Level.parse(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Level.INFO;
        }
    }

    private static final class KeystoneTestFormatter extends Formatter {

        private final boolean fullTraces;

        KeystoneTestFormatter(boolean fullTraces) {
            this.fullTraces = fullTraces;
        }

        @Override
        public String format(LogRecord record) {
            StringBuilder out = new StringBuilder(96)
                    .append('[').append(record.getLevel().getName()).append("] ")
                    .append(component(record.getLoggerName())).append(": ")
                    .append(formatMessage(record))
                    .append(System.lineSeparator());

            Throwable thrown = record.getThrown();
            if (thrown == null) {
                return out.toString();
            }
            if (fullTraces) {
                StringWriter trace = new StringWriter();
                thrown.printStackTrace(new PrintWriter(trace));
                return out.append(trace).toString();
            }
            for (Throwable t = thrown; t != null; t = t.getCause()) {
                out.append(t == thrown ? "    " : "    caused by ").append(t).append(System.lineSeparator());
            }
            return out.toString();
        }

        private static String component(String loggerName) {
            if (loggerName == null) return "?";
            return loggerName.startsWith(KEYSTONE_LOGGER + ".")
                    ? loggerName.substring(KEYSTONE_LOGGER.length() + 1)
                    : loggerName;
        }
    }
}
