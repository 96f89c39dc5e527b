package com.sanguo.engine.card;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sanguo.engine.model.CardSubType;
import com.sanguo.engine.model.CardType;

/**
 * What every copy of a card has in common.
 */
public record CardDefinition(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("card_type") CardType cardType,
    @JsonProperty("sub_type") CardSubType subType
) {
}
