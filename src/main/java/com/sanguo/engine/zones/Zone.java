package com.sanguo.engine.zones;

import com.sanguo.engine.model.Card;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An ordered area holding cards (hand, equipment, judgement, piles).
 * Index 0 is the top of the zone.
 */
public class Zone {
    private final String zoneId;
    private final Integer ownerSeat;
    private final boolean publicZone;
    private final List<Card> cards;

    public Zone(String zoneId, Integer ownerSeat, boolean publicZone) {
        this.zoneId = zoneId;
        this.ownerSeat = ownerSeat;
        this.publicZone = publicZone;
        this.cards = new ArrayList<>();
    }

    public String getZoneId() {
        return zoneId;
    }

    /**
     * Seat of the owning player, or null for shared piles.
     */
    public Integer getOwnerSeat() {
        return ownerSeat;
    }

    public boolean isPublic() {
        return publicZone;
    }

    /**
     * Put a card at the bottom of the zone. Used while setting up a game;
     * moves during play go through the {@link CardMoveService}.
     */
    public void add(Card card) {
        cards.add(card);
    }

    public void addAll(List<Card> cardsToAdd) {
        cards.addAll(cardsToAdd);
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    public boolean contains(Card card) {
        return cards.contains(card);
    }

    /**
     * Get an unmodifiable copy of the cards, top first.
     */
    public List<Card> getCards() {
        return List.copyOf(cards);
    }

    /**
     * Find a card by its instance id.
     */
    public Optional<Card> findById(int cardId) {
        return cards.stream().filter(c -> c.id() == cardId).findFirst();
    }

    /**
     * Peek at the top card without removing it.
     */
    public Optional<Card> peekTop() {
        return cards.isEmpty() ? Optional.empty() : Optional.of(cards.get(0));
    }

    // Mutation is reserved for the card-move service.
    List<Card> mutableCards() {
        return cards;
    }

    @Override
    public String toString() {
        return zoneId + cards;
    }
}
