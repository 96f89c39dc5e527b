package com.sanguo.engine.card;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sanguo.engine.model.Suit;

/**
 * One physical card of the standard deck.
 */
public record DeckEntry(
    @JsonProperty("definition") String definitionId,
    @JsonProperty("suit") Suit suit,
    @JsonProperty("rank") int rank
) {
}
