package com.sanguo.engine.zones;

public enum CardMoveTiming {
    BEFORE,
    AFTER
}
