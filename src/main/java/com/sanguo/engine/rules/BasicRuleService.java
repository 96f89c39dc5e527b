package com.sanguo.engine.rules;

import com.sanguo.engine.abilities.AbilityQueryService;
import com.sanguo.engine.choice.ChoiceResult;
import com.sanguo.engine.choice.TargetConstraints;
import com.sanguo.engine.config.EngineConfig;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.CardSubType;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule service combining the component rules with ability modifiers.
 */
public class BasicRuleService implements RuleService {
    private final EngineConfig config;
    private final RuleModifierAggregator aggregator;

    public BasicRuleService(EngineConfig config, AbilityQueryService abilities) {
        this.config = config;
        this.aggregator = new RuleModifierAggregator(abilities);
    }

    public BasicRuleService(EngineConfig config) {
        this(config, null);
    }

    @Override
    public EngineConfig getConfig() {
        return config;
    }

    public RuleModifierAggregator getAggregator() {
        return aggregator;
    }

    // ==================== ACTIONS ====================

    @Override
    public List<ActionDescriptor> availableActions(RuleContext context) {
        Game game = context.game();
        Player player = context.player();
        if (!PhaseRules.canAct(game, player).allowed()) {
            return List.of();
        }

        Map<String, List<Card>> candidates = new LinkedHashMap<>();
        for (Card card : player.getHand().getCards()) {
            String actionId = ActionIds.forSubType(card.subType());
            if (actionId != null && canUseCard(new CardUsageContext(game, player, card)).allowed()) {
                candidates.computeIfAbsent(actionId, id -> new ArrayList<>()).add(card);
            }
        }

        List<ActionDescriptor> actions = new ArrayList<>();
        for (Map.Entry<String, List<Card>> entry : candidates.entrySet()) {
            if (ActionIds.USE_SLASH.equals(entry.getKey())) {
                List<Integer> targets = slashTargets(game, player);
                if (!targets.isEmpty()) {
                    actions.add(new ActionDescriptor(entry.getKey(), entry.getValue(), TargetConstraints.single(targets)));
                }
            } else {
                actions.add(new ActionDescriptor(entry.getKey(), entry.getValue(), null));
            }
        }
        actions.add(ActionDescriptor.endPlayPhase());
        return actions;
    }

    private List<Integer> slashTargets(Game game, Player attacker) {
        return game.getAlivePlayers().stream()
                .filter(p -> p.getSeat() != attacker.getSeat())
                .filter(p -> isWithinAttackRange(game, attacker, p))
                .map(Player::getSeat)
                .toList();
    }

    @Override
    public RuleResult validateActionBeforeResolve(RuleContext context, ActionDescriptor action, ChoiceResult choice) {
        if (ActionIds.END_PLAY_PHASE.equals(action.actionId())) {
            return aggregator.validateAction(context, action, PhaseRules.canAct(context.game(), context.player()));
        }
        if (choice == null || !choice.hasCardSelection()) {
            return RuleResult.deny("rules.validate.noCardSelected");
        }
        int cardId = choice.selectedCardIds().get(0);
        Card card = action.cardCandidates().stream()
                .filter(c -> c.id() == cardId)
                .findFirst()
                .orElse(null);
        if (card == null) {
            return RuleResult.deny("rules.validate.cardNotCandidate");
        }

        RuleResult result = canUseCard(new CardUsageContext(context.game(), context.player(), card));
        if (result.allowed() && action.targetConstraints() != null) {
            result = validateTargets(context, action.targetConstraints(), choice.selectedTargetSeats(), card);
        }
        return aggregator.validateAction(context, action, result);
    }

    private RuleResult validateTargets(RuleContext context, TargetConstraints constraints,
                                       List<Integer> targets, Card card) {
        if (targets.size() < constraints.minTargets() || targets.size() > constraints.maxTargets()) {
            return RuleResult.deny("rules.validate.targetCount");
        }
        for (int seat : targets) {
            if (!constraints.allowedSeats().contains(seat)) {
                return RuleResult.deny("rules.validate.targetNotAllowed");
            }
            Player target = context.game().findPlayer(seat).orElse(null);
            if (target == null || !target.isAlive()) {
                return RuleResult.deny("rules.validate.targetNotAlive");
            }
            if (card.is(CardSubType.SLASH) && !isWithinAttackRange(context.game(), context.player(), target)) {
                return RuleResult.deny("rules.validate.targetOutOfRange");
            }
        }
        return RuleResult.ALLOWED;
    }

    // ==================== CARD USAGE ====================

    @Override
    public RuleResult canUseCard(CardUsageContext context) {
        RuleResult result = PhaseRules.canAct(context.game(), context.user());
        if (result.allowed()) {
            result = CardUsageRules.canUse(context.user(), context.card());
        }
        if (result.allowed()) {
            int used = context.game().getUsageThisTurn(context.user().getSeat(), context.card().subType());
            if (used >= maxUsesPerTurn(context)) {
                result = RuleResult.deny("rules.limit." + context.card().subType().getJsonValue() + "Exhausted");
            }
        }
        return aggregator.canUseCard(context, result);
    }

    @Override
    public int maxUsesPerTurn(CardUsageContext context) {
        return aggregator.maxUsesPerTurn(context, LimitRules.baseMaxUses(config, context.card().subType()));
    }

    // ==================== RESPONSES ====================

    @Override
    public List<Card> legalResponseCards(ResponseContext context) {
        RuleResult base = context.responder().isAlive()
                ? RuleResult.ALLOWED
                : RuleResult.deny("rules.response.responderNotAlive");
        if (!aggregator.canRespond(context, base).allowed()) {
            return List.of();
        }
        return context.responder().getHand().getCards().stream()
                .filter(card -> ResponseRules.canRespondWith(context, card).allowed())
                .toList();
    }

    // ==================== DISTANCE ====================

    @Override
    public int seatDistance(Game game, Player from, Player to) {
        int distance = aggregator.seatDistance(game, from, to, RangeRules.baseSeatDistance(game, from, to));
        return Math.max(config.getMinimumSeatDistance(), distance);
    }

    @Override
    public int attackDistance(Game game, Player attacker, Player defender) {
        return aggregator.attackDistance(game, attacker, defender, config.getBaseAttackDistance());
    }

    @Override
    public int drawCount(Game game, Player player) {
        return Math.max(0, aggregator.drawCount(game, player, config.getBaseDrawCount()));
    }
}
