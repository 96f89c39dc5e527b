package com.sanguo.engine.zones;

/**
 * Well-known zone identifiers.
 */
public final class ZoneIds {
    public static final String DRAW_PILE = "DrawPile";
    public static final String DISCARD_PILE = "DiscardPile";

    private ZoneIds() {
        // Utility class - prevent instantiation
    }

    public static String hand(int seat) {
        return "Hand_" + seat;
    }

    public static String equipment(int seat) {
        return "Equip_" + seat;
    }

    public static String judgement(int seat) {
        return "Judge_" + seat;
    }
}
