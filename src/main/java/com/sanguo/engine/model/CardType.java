package com.sanguo.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Top-level card categories.
 */
public enum CardType {
    BASIC("basic"),
    TRICK("trick"),
    EQUIP("equip");

    private final String jsonValue;

    CardType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public static CardType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Card type cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "basic" -> BASIC;
            case "trick" -> TRICK;
            case "equip" -> EQUIP;
            default -> throw new IllegalArgumentException("Unknown card type: " + value);
        };
    }
}
