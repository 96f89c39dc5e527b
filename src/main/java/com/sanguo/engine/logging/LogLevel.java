package com.sanguo.engine.logging;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LogLevel {
    DEBUG("debug"),
    INFO("info"),
    WARNING("warning"),
    ERROR("error");

    private final String jsonValue;

    LogLevel(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
