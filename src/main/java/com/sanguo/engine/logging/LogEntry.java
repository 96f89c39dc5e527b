package com.sanguo.engine.logging;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured record of something the engine did.
 *
 * @param eventType short machine-readable kind, e.g. "DamageApplied"
 * @param data      free-form key/value payload, in insertion order
 */
public record LogEntry(
    @JsonProperty("event_type") String eventType,
    @JsonProperty("level") LogLevel level,
    @JsonProperty("message") String message,
    @JsonProperty("data") Map<String, Object> data
) {
    public LogEntry {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static LogEntry info(String eventType, String message, Map<String, Object> data) {
        return new LogEntry(eventType, LogLevel.INFO, message, data);
    }

    public static LogEntry warning(String eventType, String message, Map<String, Object> data) {
        return new LogEntry(eventType, LogLevel.WARNING, message, data);
    }
}
