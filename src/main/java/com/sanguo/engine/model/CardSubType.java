package com.sanguo.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fine-grained card kinds. The equipment kinds also name the equipment slot
 * a card occupies.
 */
public enum CardSubType {
    SLASH("slash"),
    DODGE("dodge"),
    PEACH("peach"),
    WEAPON("weapon"),
    ARMOR("armor"),
    OFFENSIVE_HORSE("offensive_horse"),
    DEFENSIVE_HORSE("defensive_horse"),
    ARROW_VOLLEY("arrow_volley"),
    BARBARIAN_INVASION("barbarian_invasion"),
    IMMEDIATE_TRICK("immediate_trick"),
    DELAYED_TRICK("delayed_trick");

    private final String jsonValue;

    CardSubType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * Check if cards of this kind are placed in the equipment zone.
     */
    public boolean isEquipment() {
        return this == WEAPON || this == ARMOR || this == OFFENSIVE_HORSE || this == DEFENSIVE_HORSE;
    }

    /**
     * Check if this is a trick that hits every other living player.
     */
    public boolean isAreaAttack() {
        return this == ARROW_VOLLEY || this == BARBARIAN_INVASION;
    }

    public static CardSubType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Card sub type cannot be null");
        }
        for (CardSubType subType : values()) {
            if (subType.jsonValue.equalsIgnoreCase(value)) {
                return subType;
            }
        }
        throw new IllegalArgumentException("Unknown card sub type: " + value);
    }
}
