package com.sanguo.engine.logging;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects entries in memory, mostly for tests and replays.
 */
public class InMemoryLogSink implements LogSink {
    private final List<LogEntry> entries = new ArrayList<>();

    @Override
    public void log(LogEntry entry) {
        entries.add(entry);
    }

    public List<LogEntry> getEntries() {
        return List.copyOf(entries);
    }

    /**
     * Entries of one event type, in the order they were logged.
     */
    public List<LogEntry> ofType(String eventType) {
        return entries.stream().filter(e -> e.eventType().equals(eventType)).toList();
    }

    public void clear() {
        entries.clear();
    }
}
