package com.sanguo.engine.rules;

import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * An ability's opinion on rule queries. Every hook abstains by default by
 * returning an empty value.
 *
 * <p>For {@link CombinePolicy#OVERRIDE} queries a returned value replaces the
 * current one. For {@link CombinePolicy#ADDITIVE} queries (draw count) it is
 * a delta.
 */
public interface RuleModifier {

    default Optional<RuleResult> modifyCanUseCard(CardUsageContext context, RuleResult current) {
        return Optional.empty();
    }

    default Optional<RuleResult> modifyCanRespond(ResponseContext context, RuleResult current) {
        return Optional.empty();
    }

    default Optional<RuleResult> modifyValidateAction(RuleContext context, ActionDescriptor action, RuleResult current) {
        return Optional.empty();
    }

    default OptionalInt modifyMaxUsesPerTurn(CardUsageContext context, int current) {
        return OptionalInt.empty();
    }

    default OptionalInt modifyAttackDistance(Game game, Player attacker, Player defender, int current) {
        return OptionalInt.empty();
    }

    default OptionalInt modifySeatDistance(Game game, Player from, Player to, int current) {
        return OptionalInt.empty();
    }

    /**
     * @return the number of extra cards to draw
     */
    default OptionalInt modifyDrawCount(Game game, Player player, int current) {
        return OptionalInt.empty();
    }
}
