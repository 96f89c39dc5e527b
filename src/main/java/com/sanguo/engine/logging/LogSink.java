package com.sanguo.engine.logging;

/**
 * Optional receiver of structured engine log entries. The engine behaves
 * the same whether or not a sink is attached.
 */
@FunctionalInterface
public interface LogSink {
    void log(LogEntry entry);
}
