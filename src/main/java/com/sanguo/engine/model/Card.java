package com.sanguo.engine.model;

/**
 * A physical card instance. The id is unique within one game; many
 * instances share a definition id.
 */
public record Card(
    int id,
    String definitionId,
    String name,
    Suit suit,
    int rank,
    CardType cardType,
    CardSubType subType
) {
    public Card {
        if (rank < 1 || rank > 13) {
            throw new IllegalArgumentException("Rank must be within 1..13, got " + rank);
        }
    }

    public boolean isRed() {
        return suit.isRed();
    }

    public boolean isBlack() {
        return suit.isBlack();
    }

    public boolean is(CardSubType type) {
        return subType == type;
    }

    @Override
    public String toString() {
        return name + "#" + id + "(" + suit.getJsonValue() + " " + rank + ")";
    }
}
