package com.sanguo.engine.choice;

import java.util.List;

/**
 * A player's answer to a {@link ChoiceRequest}.
 *
 * @param confirmed tri-state: null when the request was not a confirmation
 */
public record ChoiceResult(
    String requestId,
    int playerSeat,
    List<Integer> selectedTargetSeats,
    List<Integer> selectedCardIds,
    String selectedOptionId,
    Boolean confirmed
) {
    public ChoiceResult {
        selectedTargetSeats = selectedTargetSeats == null ? List.of() : List.copyOf(selectedTargetSeats);
        selectedCardIds = selectedCardIds == null ? List.of() : List.copyOf(selectedCardIds);
    }

    /**
     * An empty selection.
     */
    public static ChoiceResult pass(ChoiceRequest request) {
        return new ChoiceResult(request.requestId(), request.playerSeat(), List.of(), List.of(), null, null);
    }

    public static ChoiceResult cards(ChoiceRequest request, Integer... cardIds) {
        return new ChoiceResult(request.requestId(), request.playerSeat(), List.of(), List.of(cardIds), null, null);
    }

    public static ChoiceResult confirm(ChoiceRequest request, boolean confirmed) {
        return new ChoiceResult(request.requestId(), request.playerSeat(), List.of(), List.of(), null, confirmed);
    }

    /**
     * A top-level action choice: the card to use and its targets.
     */
    public static ChoiceResult action(int playerSeat, int cardId, Integer... targetSeats) {
        return new ChoiceResult(null, playerSeat, List.of(targetSeats), List.of(cardId), null, null);
    }

    public boolean hasCardSelection() {
        return !selectedCardIds.isEmpty();
    }

    public boolean isConfirmed() {
        return Boolean.TRUE.equals(confirmed);
    }
}
