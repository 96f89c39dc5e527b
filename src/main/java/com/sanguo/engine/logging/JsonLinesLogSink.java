package com.sanguo.engine.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Writes each entry as one line of JSON.
 */
public class JsonLinesLogSink implements LogSink {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Writer writer;

    public JsonLinesLogSink(Writer writer) {
        this.writer = writer;
    }

    @Override
    public void log(LogEntry entry) {
        try {
            writer.write(toJson(entry));
            writer.write(System.lineSeparator());
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write log entry " + entry.eventType(), e);
        }
    }

    /**
     * Serialize one entry to a JSON object string.
     */
    public static String toJson(LogEntry entry) throws JsonProcessingException {
        return MAPPER.writeValueAsString(entry);
    }
}
