package com.sanguo.engine.zones;

import com.sanguo.engine.model.Card;

import java.util.List;

/**
 * Outcome of a move: the cards actually moved, in the order they were placed.
 */
public record CardMoveResult(CardMoveDescriptor descriptor, List<Card> movedCards) {
    public boolean isEmpty() {
        return movedCards.isEmpty();
    }
}
