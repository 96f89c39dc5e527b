package com.sanguo.engine.rules;

import com.sanguo.engine.abilities.Ability;
import com.sanguo.engine.abilities.AbilityCapability;
import com.sanguo.engine.abilities.AbilityQueryService;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Folds the opinions of every rule-modifying ability into the base answer
 * of a rule query. Abilities are looked up on each call, never cached, so an
 * ability gained or lost mid-turn is seen immediately.
 */
public class RuleModifierAggregator {

    @FunctionalInterface
    private interface IntHook {
        OptionalInt apply(RuleModifier modifier, int current);
    }

    @FunctionalInterface
    private interface ResultHook {
        Optional<RuleResult> apply(RuleModifier modifier, RuleResult current);
    }

    private final AbilityQueryService abilities;

    /**
     * @param abilities source of active abilities; null means no modifiers
     */
    public RuleModifierAggregator(AbilityQueryService abilities) {
        this.abilities = abilities;
    }

    public RuleResult canUseCard(CardUsageContext context, RuleResult base) {
        return foldResult(context.game(), List.of(context.user()), base,
                (m, current) -> m.modifyCanUseCard(context, current));
    }

    public RuleResult canRespond(ResponseContext context, RuleResult base) {
        return foldResult(context.game(), List.of(context.responder()), base,
                (m, current) -> m.modifyCanRespond(context, current));
    }

    public RuleResult validateAction(RuleContext context, ActionDescriptor action, RuleResult base) {
        return foldResult(context.game(), List.of(context.player()), base,
                (m, current) -> m.modifyValidateAction(context, action, current));
    }

    public int maxUsesPerTurn(CardUsageContext context, int base) {
        return fold(RuleQuery.MAX_USES_PER_TURN, context.game(), List.of(context.user()), base,
                (m, current) -> m.modifyMaxUsesPerTurn(context, current));
    }

    public int attackDistance(Game game, Player attacker, Player defender, int base) {
        return fold(RuleQuery.ATTACK_DISTANCE, game, List.of(attacker), base,
                (m, current) -> m.modifyAttackDistance(game, attacker, defender, current));
    }

    /**
     * Distance modifiers of the destination player apply first, then those
     * of the origin player.
     */
    public int seatDistance(Game game, Player from, Player to, int base) {
        return fold(RuleQuery.SEAT_DISTANCE, game, List.of(to, from), base,
                (m, current) -> m.modifySeatDistance(game, from, to, current));
    }

    public int drawCount(Game game, Player player, int base) {
        return fold(RuleQuery.DRAW_COUNT, game, List.of(player), base,
                (m, current) -> m.modifyDrawCount(game, player, current));
    }

    private int fold(RuleQuery query, Game game, List<Player> owners, int base, IntHook hook) {
        int value = base;
        for (RuleModifier modifier : modifiersOf(game, owners)) {
            OptionalInt opinion = hook.apply(modifier, value);
            if (opinion.isPresent()) {
                value = query.getPolicy().combine(value, opinion.getAsInt());
            }
        }
        return value;
    }

    private RuleResult foldResult(Game game, List<Player> owners, RuleResult base, ResultHook hook) {
        RuleResult value = base;
        for (RuleModifier modifier : modifiersOf(game, owners)) {
            Optional<RuleResult> opinion = hook.apply(modifier, value);
            if (opinion.isPresent()) {
                value = opinion.get();
            }
        }
        return value;
    }

    private List<RuleModifier> modifiersOf(Game game, List<Player> owners) {
        if (abilities == null) {
            return List.of();
        }
        List<RuleModifier> modifiers = new ArrayList<>();
        for (Player owner : owners) {
            for (Ability ability : abilities.activeAbilities(game, owner)) {
                if (ability.capabilities().contains(AbilityCapability.MODIFIES_RULES)
                        && ability instanceof RuleModifier modifier) {
                    modifiers.add(modifier);
                }
            }
        }
        return modifiers;
    }
}
