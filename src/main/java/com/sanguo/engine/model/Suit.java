package com.sanguo.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Card suits. Hearts and diamonds are red, spades and clubs are black.
 */
public enum Suit {
    SPADE("spade", false),
    HEART("heart", true),
    CLUB("club", false),
    DIAMOND("diamond", true);

    private final String jsonValue;
    private final boolean red;

    Suit(String jsonValue, boolean red) {
        this.jsonValue = jsonValue;
        this.red = red;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public boolean isRed() {
        return red;
    }

    public boolean isBlack() {
        return !red;
    }

    public static Suit fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Suit cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "spade" -> SPADE;
            case "heart" -> HEART;
            case "club" -> CLUB;
            case "diamond" -> DIAMOND;
            default -> throw new IllegalArgumentException("Unknown suit: " + value);
        };
    }
}
