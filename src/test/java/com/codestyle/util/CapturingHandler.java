package com.codestyle.util;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Collects log records so tests can assert on what was logged.
 */
public class CapturingHandler extends Handler {
    private final List<LogRecord> records = new CopyOnWriteArrayList<>();

    /**
     * Creates an isolated logger writing only to this handler.
     */
    public Logger newLogger() {
        Logger logger = Logger.getLogger("test." + UUID.randomUUID());
        logger.setUseParentHandlers(false);
        logger.setLevel(Level.ALL);
        logger.addHandler(this);
        setLevel(Level.ALL);
        return logger;
    }

    @Override
    public void publish(LogRecord record) {
        records.add(record);
    }

    @Override
    public void flush() {
    }

    @Override
    public void close() {
    }

    public List<LogRecord> getRecords() {
        return records;
    }

    public List<String> messagesAt(Level level) {
        return records.stream()
                .filter(r -> r.getLevel().equals(level))
                .map(LogRecord::getMessage)
                .collect(Collectors.toList());
    }
}
