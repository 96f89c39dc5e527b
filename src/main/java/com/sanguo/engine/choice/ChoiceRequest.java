package com.sanguo.engine.choice;

import com.sanguo.engine.model.Card;

import java.util.List;

/**
 * A decision the engine needs from one player.
 *
 * @param targetConstraints null unless the choice selects targets
 * @param allowedCards      null unless the choice selects cards
 * @param responseWindowId  null outside response windows
 * @param canPass           whether an empty selection is acceptable
 */
public record ChoiceRequest(
    String requestId,
    int playerSeat,
    ChoiceType choiceType,
    TargetConstraints targetConstraints,
    List<Card> allowedCards,
    String responseWindowId,
    boolean canPass
) {
}
