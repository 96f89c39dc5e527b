package com.sanguo.engine.response;

import com.sanguo.engine.abilities.ResponseRequirementModifier;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.resolution.ResolutionContext;
import com.sanguo.engine.rules.ResponseType;

/**
 * Number of cards a responder must play, after the source player's
 * abilities have had their say.
 */
public final class ResponseRequirementCalculator {

    private ResponseRequirementCalculator() {
        // Utility class - prevent instantiation
    }

    public static int requiredCount(ResolutionContext context, Player source, Player responder, ResponseType type) {
        int required = 1;
        for (ResponseRequirementModifier modifier : context.abilitiesOf(source, ResponseRequirementModifier.class)) {
            required = modifier.modifyRequiredCount(context.getGame(), source, responder, type, required);
        }
        return Math.max(1, required);
    }
}
