package com.sanguo.engine.zones;

/**
 * Where moved cards land in the target zone.
 */
public enum CardMoveOrdering {
    /** In front of the existing cards, keeping the moved cards' relative order. */
    TO_TOP,
    /** Behind the existing cards. */
    TO_BOTTOM,
    /** Appended in the order given. */
    PRESERVE_ORDER
}
