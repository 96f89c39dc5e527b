package com.sanguo.engine.choice;

import com.sanguo.engine.model.Card;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds choice requests with sequential ids, so replays with the same seed
 * see the same request ids.
 */
public class ChoiceRequestFactory {
    private final AtomicLong sequence = new AtomicLong();

    public ChoiceRequest forResponse(int seat, List<Card> legalCards, String windowId) {
        return new ChoiceRequest(nextId(), seat, ChoiceType.SELECT_CARDS, null, List.copyOf(legalCards), windowId, true);
    }

    public ChoiceRequest forConfirm(int seat) {
        return new ChoiceRequest(nextId(), seat, ChoiceType.CONFIRM, null, null, null, true);
    }

    public ChoiceRequest forCards(int seat, List<Card> allowedCards, boolean canPass) {
        return new ChoiceRequest(nextId(), seat, ChoiceType.SELECT_CARDS, null, List.copyOf(allowedCards), null, canPass);
    }

    public ChoiceRequest forTargets(int seat, TargetConstraints constraints) {
        return new ChoiceRequest(nextId(), seat, ChoiceType.SELECT_TARGETS, constraints, null, null, false);
    }

    private String nextId() {
        return "req-" + sequence.incrementAndGet();
    }
}
