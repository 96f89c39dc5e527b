package com.sanguo.engine.rules;

import com.sanguo.engine.choice.ChoiceResult;
import com.sanguo.engine.config.EngineConfig;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

import java.util.List;

/**
 * Every rule question the resolvers ask. Answers include the opinions of
 * rule-modifying abilities.
 */
public interface RuleService {

    /**
     * Actions available to the context player right now. Empty outside the
     * player's play phase.
     */
    List<ActionDescriptor> availableActions(RuleContext context);

    /**
     * Last check before an action is resolved, once the player has chosen
     * the card and targets.
     */
    RuleResult validateActionBeforeResolve(RuleContext context, ActionDescriptor action, ChoiceResult choice);

    RuleResult canUseCard(CardUsageContext context);

    /**
     * Cards in the responder's hand that may answer the response.
     */
    List<Card> legalResponseCards(ResponseContext context);

    /**
     * Whether the responder could answer at all.
     */
    default boolean canRespondWithCard(ResponseContext context) {
        return !legalResponseCards(context).isEmpty();
    }

    int seatDistance(Game game, Player from, Player to);

    int attackDistance(Game game, Player attacker, Player defender);

    default boolean isWithinAttackRange(Game game, Player attacker, Player defender) {
        return seatDistance(game, attacker, defender) <= attackDistance(game, attacker, defender);
    }

    int maxUsesPerTurn(CardUsageContext context);

    int drawCount(Game game, Player player);

    EngineConfig getConfig();
}
