package com.sanguo.engine.rules;

import com.sanguo.engine.config.EngineConfig;
import com.sanguo.engine.model.CardSubType;

/**
 * Base per-turn usage limits, before ability modifiers.
 */
public final class LimitRules {

    private LimitRules() {
        // Utility class - prevent instantiation
    }

    /**
     * Base number of uses per turn for a card kind.
     */
    public static int baseMaxUses(EngineConfig config, CardSubType subType) {
        if (subType == CardSubType.SLASH) {
            return config.getMaxSlashesPerTurn();
        }
        return Integer.MAX_VALUE;
    }
}
