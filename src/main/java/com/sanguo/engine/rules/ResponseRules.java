package com.sanguo.engine.rules;

import com.sanguo.engine.model.Card;

/**
 * Which card kinds answer which response types.
 */
public final class ResponseRules {

    private ResponseRules() {
        // Utility class - prevent instantiation
    }

    public static RuleResult canRespondWith(ResponseContext context, Card card) {
        if (!context.responder().isAlive()) {
            return RuleResult.deny("rules.response.responderNotAlive");
        }
        if (!card.is(context.responseType().getAnsweredBy())) {
            return RuleResult.deny("rules.response.wrongCardType");
        }
        return RuleResult.ALLOWED;
    }
}
