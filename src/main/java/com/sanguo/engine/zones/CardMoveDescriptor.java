package com.sanguo.engine.zones;

import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;

import java.util.List;
import java.util.Objects;

/**
 * One requested move of cards between two zones.
 *
 * @param game optional; when present, move events are published on the game's bus
 */
public record CardMoveDescriptor(
    Zone source,
    Zone target,
    List<Card> cards,
    CardMoveReason reason,
    CardMoveOrdering ordering,
    Game game
) {
    public CardMoveDescriptor {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(cards, "cards");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(ordering, "ordering");
        cards = List.copyOf(cards);
    }

    public static CardMoveDescriptor of(Game game, Zone source, Zone target, Card card,
                                        CardMoveReason reason, CardMoveOrdering ordering) {
        return new CardMoveDescriptor(source, target, List.of(card), reason, ordering, game);
    }
}
