package com.sanguo.engine.resolution;

/**
 * @param sequence 1-based position in resolution order
 */
public record HistoryEntry(int sequence, String kind, boolean success) {
}
