package com.sanguo.engine.zones;

import com.sanguo.engine.events.CardMovedEvent;
import com.sanguo.engine.events.EventBus;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Default card-move service. Validates every move before touching any zone,
 * so a rejected move leaves the game unchanged.
 */
public class BasicCardMoveService implements CardMoveService {
    private static final Logger log = LoggerFactory.getLogger(BasicCardMoveService.class);

    private final EventBus eventBus;

    public BasicCardMoveService() {
        this(null);
    }

    /**
     * @param eventBus optional; when set, {@link CardMovedEvent}s are published
     *                 for moves whose descriptor names a game
     */
    public BasicCardMoveService(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public CardMoveResult move(CardMoveDescriptor descriptor) {
        List<Card> cards = descriptor.cards();
        if (cards.isEmpty()) {
            return new CardMoveResult(descriptor, List.of());
        }

        Zone source = descriptor.source();
        Zone target = descriptor.target();
        List<Card> sourceCards = source.mutableCards();
        List<Card> targetCards = target.mutableCards();

        Set<Integer> seen = new HashSet<>();
        for (Card card : cards) {
            if (!seen.add(card.id())) {
                throw new IllegalStateException("Card " + card.id() + " listed twice in one move");
            }
            if (!sourceCards.contains(card)) {
                throw new IllegalStateException("Card " + card.id() + " is not in source zone " + source.getZoneId());
            }
            if (targetCards.contains(card)) {
                throw new IllegalStateException("Card " + card.id() + " is already in target zone " + target.getZoneId());
            }
        }

        publish(descriptor, CardMoveTiming.BEFORE);

        sourceCards.removeAll(cards);
        switch (descriptor.ordering()) {
            case TO_TOP -> targetCards.addAll(0, cards);
            case TO_BOTTOM, PRESERVE_ORDER -> targetCards.addAll(cards);
        }
        log.debug("Moved {} from {} to {} ({})", cards, source.getZoneId(), target.getZoneId(), descriptor.reason());

        publish(descriptor, CardMoveTiming.AFTER);
        return new CardMoveResult(descriptor, List.copyOf(cards));
    }

    @Override
    public void ensureDrawable(Game game, int count) throws DeckExhaustedException {
        Zone drawPile = game.getDrawPile();
        if (drawPile.size() >= count) {
            return;
        }
        Zone discardPile = game.getDiscardPile();
        if (drawPile.size() + discardPile.size() < count) {
            throw new DeckExhaustedException("Need " + count + " card(s) but only "
                    + drawPile.size() + " in draw pile and " + discardPile.size() + " in discard pile");
        }
        List<Card> reshuffled = new ArrayList<>(discardPile.getCards());
        game.getRng().shuffle(reshuffled);
        move(new CardMoveDescriptor(discardPile, drawPile, reshuffled,
                CardMoveReason.RESHUFFLE, CardMoveOrdering.TO_BOTTOM, game));
        log.debug("Reshuffled {} card(s) from the discard pile into the draw pile", reshuffled.size());
    }

    @Override
    public List<Card> drawCards(Game game, Player player, int count) throws DeckExhaustedException {
        if (count < 0) {
            throw new IllegalArgumentException("Draw count must not be negative, got " + count);
        }
        if (count == 0) {
            return List.of();
        }
        ensureDrawable(game, count);
        List<Card> drawn = new ArrayList<>(game.getDrawPile().getCards().subList(0, count));
        move(new CardMoveDescriptor(game.getDrawPile(), player.getHand(), drawn,
                CardMoveReason.DRAW, CardMoveOrdering.PRESERVE_ORDER, game));
        return drawn;
    }

    @Override
    public CardMoveResult discardFromHand(Game game, Player player, List<Card> cards) {
        return move(new CardMoveDescriptor(player.getHand(), game.getDiscardPile(), cards,
                CardMoveReason.DISCARD, CardMoveOrdering.TO_TOP, game));
    }

    private void publish(CardMoveDescriptor descriptor, CardMoveTiming timing) {
        if (eventBus == null || descriptor.game() == null) {
            return;
        }
        eventBus.publish(new CardMovedEvent(
                descriptor.game(),
                descriptor.source().getZoneId(),
                descriptor.source().getOwnerSeat(),
                descriptor.target().getZoneId(),
                descriptor.target().getOwnerSeat(),
                descriptor.cards().stream().map(Card::id).toList(),
                descriptor.reason(),
                descriptor.ordering(),
                timing));
    }
}
