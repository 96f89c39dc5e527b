package com.sanguo.engine.resolution;

import com.sanguo.engine.choice.ChoiceResult;
import com.sanguo.engine.events.CardUsedEvent;
import com.sanguo.engine.logging.LogEntry;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.rules.ActionDescriptor;
import com.sanguo.engine.rules.RuleContext;
import com.sanguo.engine.rules.RuleResult;
import com.sanguo.engine.zones.CardMoveDescriptor;
import com.sanguo.engine.zones.CardMoveOrdering;
import com.sanguo.engine.zones.CardMoveReason;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point of an actively used card: validates the action, pays the
 * card and pushes the card's own resolver.
 */
public class UseCardResolver implements Resolver {
    public static final String KIND = "use-card";

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public ResolutionResult resolve(ResolutionContext context) {
        ActionDescriptor action = context.getAction();
        ChoiceResult choice = context.getChoice();
        if (action == null || choice == null) {
            return ResolutionResult.failure(ResolutionErrorCode.INVALID_STATE, "resolution.useCard.missingAction");
        }

        Game game = context.getGame();
        Player user = context.getActingPlayer();
        RuleResult validation = context.getRuleService()
                .validateActionBeforeResolve(new RuleContext(game, user), action, choice);
        if (!validation.allowed()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("seat", user.getSeat());
            data.put("action", action.actionId());
            data.put("reason", validation.reason());
            context.log(LogEntry.warning("ActionRejected", "Action failed validation", data));
            return ResolutionResult.failure(ResolutionErrorCode.RULE_VALIDATION_FAILED, validation.reason());
        }

        int cardId = choice.selectedCardIds().get(0);
        Card card = user.getHand().findById(cardId).orElse(null);
        if (card == null) {
            return ResolutionResult.failure(ResolutionErrorCode.CARD_NOT_FOUND, "resolution.useCard.cardNotInHand");
        }

        game.recordUsage(user.getSeat(), card.subType());
        if (card.subType().isEquipment()) {
            context.getStack().push(new EquipResolver(card), context);
            return ResolutionResult.SUCCESS;
        }

        Resolver effect = switch (card.subType()) {
            case SLASH -> new AttackResolver();
            case PEACH -> new HealResolver(user.getSeat(), 1);
            case ARROW_VOLLEY -> AreaAttackResolver.arrowVolley();
            case BARBARIAN_INVASION -> AreaAttackResolver.barbarianInvasion();
            default -> null;
        };
        if (effect == null) {
            return ResolutionResult.failure(ResolutionErrorCode.INVALID_STATE, "resolution.useCard.unsupportedCard");
        }

        context.getCardMoveService().move(CardMoveDescriptor.of(game, user.getHand(), game.getDiscardPile(), card,
                CardMoveReason.PLAY, CardMoveOrdering.TO_TOP));
        context.publish(new CardUsedEvent(game, user.getSeat(), card, choice.selectedTargetSeats()));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("seat", user.getSeat());
        data.put("card_id", card.id());
        data.put("card", card.definitionId());
        data.put("targets", choice.selectedTargetSeats());
        context.log(LogEntry.info("CardUsed", "Card used", data));

        context.getStack().push(effect, context);
        return ResolutionResult.SUCCESS;
    }
}
