package com.sanguo.engine.rules;

import com.sanguo.engine.model.CardSubType;

/**
 * Identifiers of the actions offered in the play phase.
 */
public final class ActionIds {
    public static final String USE_SLASH = "UseSlash";
    public static final String USE_PEACH = "UsePeach";
    public static final String USE_EQUIPMENT = "UseEquipment";
    public static final String USE_ARROW_VOLLEY = "UseArrowVolley";
    public static final String USE_BARBARIAN_INVASION = "UseBarbarianInvasion";
    public static final String END_PLAY_PHASE = "EndPlayPhase";

    private ActionIds() {
        // Utility class - prevent instantiation
    }

    /**
     * Action id for actively using a card of the given kind, or null if such
     * cards cannot be used actively.
     */
    public static String forSubType(CardSubType subType) {
        if (subType.isEquipment()) {
            return USE_EQUIPMENT;
        }
        return switch (subType) {
            case SLASH -> USE_SLASH;
            case PEACH -> USE_PEACH;
            case ARROW_VOLLEY -> USE_ARROW_VOLLEY;
            case BARBARIAN_INVASION -> USE_BARBARIAN_INVASION;
            default -> null;
        };
    }
}
