package com.tyron.keystone.testFramework;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Collects the records published to a logger and its children while attached.
 */
public final class LogCapture extends Handler implements AutoCloseable {

    private final Logger logger;
    private final Level previousLevel;
    private final List<LogRecord> records = new ArrayList<>();

    private LogCapture(Logger logger, Level level) {
        this.logger = logger;
        this.previousLevel = logger.getLevel();
        setLevel(level);
        logger.setLevel(level);
        logger.addHandler(this);
    }

    public static LogCapture attach(String loggerName) {
        return attach(loggerName, Level.ALL);
    }

    public static LogCapture attach(String loggerName, Level level) {
        return new LogCapture(Logger.getLogger(loggerName), level);
    }

    @Override
    public synchronized void publish(LogRecord record) {
        if (isLoggable(record)) {
            records.add(record);
        }
    }

    public synchronized List<LogRecord> getRecords() {
        return List.copyOf(records);
    }

    /**
     * @return formatted messages of the records at or above {@code level}
     */
    public synchronized List<String> messages(Level level) {
        List<String> messages = new ArrayList<>();
        for (LogRecord record : records) {
            if (record.getLevel().intValue() >= level.intValue()) {
                messages.add(record.getMessage());
            }
        }
        return messages;
    }

    public boolean contains(Level level, String fragment) {
        return messages(level).stream().anyMatch(m -> m != null && m.contains(fragment));
    }

    public synchronized void clear() {
        records.clear();
    }

    @Override
    public void flush() {
    }

    @Override
    public void close() {
        logger.removeHandler(this);
        logger.setLevel(previousLevel);
    }
}
