package com.sanguo.engine.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards structured entries to an SLF4J logger.
 */
public class Slf4jLogSink implements LogSink {
    private final Logger logger;

    public Slf4jLogSink() {
        this(LoggerFactory.getLogger("com.sanguo.engine.game-log"));
    }

    public Slf4jLogSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void log(LogEntry entry) {
        switch (entry.level()) {
            case DEBUG -> logger.debug("[{}] {} {}", entry.eventType(), entry.message(), entry.data());
            case INFO -> logger.info("[{}] {} {}", entry.eventType(), entry.message(), entry.data());
            case WARNING -> logger.warn("[{}] {} {}", entry.eventType(), entry.message(), entry.data());
            case ERROR -> logger.error("[{}] {} {}", entry.eventType(), entry.message(), entry.data());
        }
    }
}
