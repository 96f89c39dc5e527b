package com.sanguo.engine.resolution;

import com.sanguo.engine.abilities.EvadeJudgementAbility;
import com.sanguo.engine.abilities.ResponseAssistanceAbility;
import com.sanguo.engine.choice.ChoiceResult;
import com.sanguo.engine.logging.LogEntry;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.response.DodgeProviderChainResolver;
import com.sanguo.engine.response.DodgeRequestContext;
import com.sanguo.engine.response.ResponseRequirementCalculator;
import com.sanguo.engine.response.ResponseWindows;
import com.sanguo.engine.rules.ActionDescriptor;
import com.sanguo.engine.rules.ResponseType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves a slash against its chosen target: checks the target, applies
 * card-effect filters, then schedules the dodge step and the outcome.
 */
public class AttackResolver implements Resolver {
    public static final String KIND = "attack";

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public ResolutionResult resolve(ResolutionContext context) {
        ChoiceResult choice = context.getChoice();
        if (context.getChoiceProvider() == null) {
            return ResolutionResult.failure(ResolutionErrorCode.INVALID_STATE, "resolution.attack.noChoiceProvider");
        }
        if (choice == null || choice.selectedTargetSeats().isEmpty()) {
            return ResolutionResult.failure(ResolutionErrorCode.INVALID_TARGET, "resolution.attack.noTarget");
        }

        Game game = context.getGame();
        Player attacker = context.getActingPlayer();
        Player defender = game.findPlayer(choice.selectedTargetSeats().get(0)).orElse(null);
        if (defender == null) {
            return ResolutionResult.failure(ResolutionErrorCode.INVALID_TARGET, "resolution.attack.unknownTarget");
        }
        if (!defender.isAlive()) {
            return ResolutionResult.failure(ResolutionErrorCode.TARGET_NOT_ALIVE, "resolution.attack.targetNotAlive");
        }

        Card card = findSlashCard(context, choice);
        if (card == null) {
            return ResolutionResult.failure(ResolutionErrorCode.CARD_NOT_FOUND, "resolution.attack.cardNotFound");
        }

        Optional<String> veto = CardEffects.findVeto(context, attacker, defender, card);
        if (veto.isPresent()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("attacker", attacker.getSeat());
            data.put("defender", defender.getSeat());
            data.put("card_id", card.id());
            data.put("vetoed_by", veto.get());
            context.log(LogEntry.info("SlashNullified", "Slash had no effect", data));
            return ResolutionResult.SUCCESS;
        }

        ScratchPad scratch = context.requireScratchPad();
        scratch.remove(ScratchKeys.LAST_RESPONSE);
        scratch.remove(ScratchKeys.DODGE_REQUEST);

        DamageDescriptor damage = new DamageDescriptor(attacker.getSeat(), defender.getSeat(),
                context.getConfig().getSlashDamage(), DamageType.NORMAL, "Slash", card, true, true, null);
        AttackSource source = new AttackSource(attacker.getSeat(), defender.getSeat(), card);
        int required = ResponseRequirementCalculator.requiredCount(context, attacker, defender,
                ResponseType.JINK_AGAINST_SLASH);

        context.getStack().push(new AttackOutcomeResolver(source), context.withPendingDamage(damage));
        if (hasAlternativeEvade(context, defender)) {
            context.getStack().push(new DodgeProviderChainResolver(new DodgeRequestContext(source, required)), context);
        } else {
            context.getStack().push(ResponseWindows.jink(source, required), context);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("attacker", attacker.getSeat());
        data.put("defender", defender.getSeat());
        data.put("card_id", card.id());
        data.put("required_dodges", required);
        context.log(LogEntry.info("SlashDeclared", "Slash declared", data));
        return ResolutionResult.SUCCESS;
    }

    private Card findSlashCard(ResolutionContext context, ChoiceResult choice) {
        if (!choice.hasCardSelection()) {
            return null;
        }
        int cardId = choice.selectedCardIds().get(0);
        ActionDescriptor action = context.getAction();
        if (action != null) {
            for (Card candidate : action.cardCandidates()) {
                if (candidate.id() == cardId) {
                    return candidate;
                }
            }
        }
        return context.getActingPlayer().getHand().findById(cardId).orElse(null);
    }

    private boolean hasAlternativeEvade(ResolutionContext context, Player defender) {
        return !context.abilitiesOf(defender, EvadeJudgementAbility.class).isEmpty()
                || !context.abilitiesOf(defender, ResponseAssistanceAbility.class).isEmpty();
    }
}
