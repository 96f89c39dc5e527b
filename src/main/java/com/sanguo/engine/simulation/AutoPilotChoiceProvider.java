package com.sanguo.engine.simulation;

import com.sanguo.engine.choice.ChoiceProvider;
import com.sanguo.engine.choice.ChoiceRequest;
import com.sanguo.engine.choice.ChoiceResult;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.CardSubType;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

import java.util.List;
import java.util.Objects;

/**
 * Simple automatic player: dodges whenever it can, saves itself and its
 * faction allies from dying, and confirms every optional prompt.
 */
public class AutoPilotChoiceProvider implements ChoiceProvider {
    private final Game game;

    public AutoPilotChoiceProvider(Game game) {
        this.game = game;
    }

    @Override
    public ChoiceResult choose(ChoiceRequest request) {
        return switch (request.choiceType()) {
            case CONFIRM -> ChoiceResult.confirm(request, true);
            case SELECT_CARDS -> chooseCard(request);
            case SELECT_TARGETS -> chooseTarget(request);
            case SELECT_OPTION -> ChoiceResult.pass(request);
        };
    }

    private ChoiceResult chooseCard(ChoiceRequest request) {
        List<Card> allowed = request.allowedCards();
        if (allowed == null || allowed.isEmpty()) {
            return ChoiceResult.pass(request);
        }
        Card card = allowed.get(0);
        if (card.is(CardSubType.PEACH) && !wantsToRescue(request.playerSeat())) {
            return ChoiceResult.pass(request);
        }
        return ChoiceResult.cards(request, card.id());
    }

    private boolean wantsToRescue(int seat) {
        Player self = game.getPlayer(seat);
        return game.getAlivePlayers().stream()
                .filter(p -> p.getCurrentHealth() == 0)
                .anyMatch(p -> p.getSeat() == seat || Objects.equals(p.getFactionId(), self.getFactionId()));
    }

    private ChoiceResult chooseTarget(ChoiceRequest request) {
        if (request.targetConstraints() == null || request.targetConstraints().allowedSeats().isEmpty()) {
            return ChoiceResult.pass(request);
        }
        int target = request.targetConstraints().allowedSeats().get(0);
        return new ChoiceResult(request.requestId(), request.playerSeat(), List.of(target), List.of(), null, null);
    }
}
