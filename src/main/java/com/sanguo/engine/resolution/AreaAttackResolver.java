package com.sanguo.engine.resolution;

import com.sanguo.engine.choice.ChoiceResult;
import com.sanguo.engine.logging.LogEntry;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.response.ResponseWindows;
import com.sanguo.engine.rules.ActionDescriptor;
import com.sanguo.engine.rules.ResponseType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves a trick that hits every other living player. Each target, in
 * seat order from the user's left, gets its own response window followed
 * by an {@link AreaAttackOutcomeResolver} carrying that target's damage.
 */
public class AreaAttackResolver implements Resolver {
    public static final String KIND = "area-attack";
    public static final int DAMAGE = 1;

    private final ResponseType responseType;
    private final String reason;

    public AreaAttackResolver(ResponseType responseType, String reason) {
        this.responseType = responseType;
        this.reason = reason;
    }

    /** Every other player must play a dodge or take a damage. */
    public static AreaAttackResolver arrowVolley() {
        return new AreaAttackResolver(ResponseType.JINK_AGAINST_VOLLEY, "ArrowVolley");
    }

    /** Every other player must play a slash or take a damage. */
    public static AreaAttackResolver barbarianInvasion() {
        return new AreaAttackResolver(ResponseType.SLASH_AGAINST_INVASION, "BarbarianInvasion");
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public ResolutionResult resolve(ResolutionContext context) {
        Game game = context.getGame();
        Player user = context.getActingPlayer();
        Card card = findUsedCard(context);
        if (card == null) {
            return ResolutionResult.failure(ResolutionErrorCode.CARD_NOT_FOUND, "resolution.areaAttack.cardNotFound");
        }

        List<Integer> targets = new ArrayList<>();
        for (int seat : targetsInOrder(game, user.getSeat())) {
            Optional<String> veto = CardEffects.findVeto(context, user, game.getPlayer(seat), card);
            if (veto.isPresent()) {
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("user", user.getSeat());
                data.put("target", seat);
                data.put("card_id", card.id());
                data.put("vetoed_by", veto.get());
                context.log(LogEntry.info("AreaAttackNullified", "Area attack had no effect on target", data));
            } else {
                targets.add(seat);
            }
        }

        context.requireScratchPad().remove(ScratchKeys.LAST_RESPONSE);
        // Last target first, so the first target's window ends up on top.
        for (int i = targets.size() - 1; i >= 0; i--) {
            int seat = targets.get(i);
            DamageDescriptor damage = new DamageDescriptor(user.getSeat(), seat, DAMAGE, DamageType.NORMAL, reason,
                    card, true, true, null);
            context.getStack().push(new AreaAttackOutcomeResolver(), context.withPendingDamage(damage));
            context.getStack().push(ResponseWindows.areaAttack(responseType, seat, card), context);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user", user.getSeat());
        data.put("card_id", card.id());
        data.put("response_type", responseType.name());
        data.put("targets", targets);
        context.log(LogEntry.info("AreaAttackDeclared", "Area attack declared", data));
        return ResolutionResult.SUCCESS;
    }

    /**
     * Living players other than the user, starting with the one after the
     * user.
     */
    static List<Integer> targetsInOrder(Game game, int userSeat) {
        List<Integer> seats = new ArrayList<>();
        int seat = game.nextAliveSeat(userSeat);
        while (seat != userSeat && !seats.contains(seat)) {
            seats.add(seat);
            seat = game.nextAliveSeat(seat);
        }
        return seats;
    }

    private Card findUsedCard(ResolutionContext context) {
        ChoiceResult choice = context.getChoice();
        if (choice == null || !choice.hasCardSelection()) {
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
        return context.getGame().getDiscardPile().findById(cardId).orElse(null);
    }
}
