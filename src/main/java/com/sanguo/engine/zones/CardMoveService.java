package com.sanguo.engine.zones;

import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

import java.util.List;

/**
 * The only way cards change zone during play.
 */
public interface CardMoveService {

    /**
     * Move cards between two zones.
     * @throws IllegalStateException if a card is missing from the source,
     *         already present in the target, or listed twice
     */
    CardMoveResult move(CardMoveDescriptor descriptor);

    /**
     * Make sure the draw pile holds at least {@code count} cards, shuffling
     * the discard pile back in when it runs short.
     * @throws DeckExhaustedException if both piles together cannot supply them
     */
    void ensureDrawable(Game game, int count) throws DeckExhaustedException;

    /**
     * Draw cards from the top of the draw pile into a player's hand.
     * @return the drawn cards, in draw order
     */
    List<Card> drawCards(Game game, Player player, int count) throws DeckExhaustedException;

    /**
     * Move cards from a player's hand to the top of the discard pile.
     */
    CardMoveResult discardFromHand(Game game, Player player, List<Card> cards);
}
