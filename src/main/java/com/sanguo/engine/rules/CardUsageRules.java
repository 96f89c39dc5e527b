package com.sanguo.engine.rules;

import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Player;

/**
 * Base answers on whether a card may be used actively, ignoring phase and
 * per-turn limits.
 */
public final class CardUsageRules {

    private CardUsageRules() {
        // Utility class - prevent instantiation
    }

    public static RuleResult canUse(Player user, Card card) {
        if (!user.isAlive()) {
            return RuleResult.deny("rules.usage.userNotAlive");
        }
        if (!user.getHand().contains(card)) {
            return RuleResult.deny("rules.usage.cardNotInHand");
        }
        return switch (card.subType()) {
            case SLASH, WEAPON, ARMOR, OFFENSIVE_HORSE, DEFENSIVE_HORSE, ARROW_VOLLEY, BARBARIAN_INVASION ->
                    RuleResult.ALLOWED;
            case PEACH -> user.isInjured() ? RuleResult.ALLOWED : RuleResult.deny("rules.usage.peachNotInjured");
            case DODGE -> RuleResult.deny("rules.usage.dodgeResponseOnly");
            default -> RuleResult.deny("rules.usage.unsupportedCard");
        };
    }
}
