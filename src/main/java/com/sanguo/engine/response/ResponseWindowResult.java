package com.sanguo.engine.response;

import com.sanguo.engine.model.Card;

import java.util.List;

/**
 * @param responderSeat seat that answered; null when nobody did
 * @param playedCards   cards played by that responder, in play order
 */
public record ResponseWindowResult(ResponseOutcome outcome, Integer responderSeat, List<Card> playedCards) {
    public ResponseWindowResult {
        playedCards = playedCards == null ? List.of() : List.copyOf(playedCards);
    }

    public static ResponseWindowResult noResponse() {
        return new ResponseWindowResult(ResponseOutcome.NO_RESPONSE, null, List.of());
    }

    public static ResponseWindowResult success(int seat, List<Card> cards) {
        return new ResponseWindowResult(ResponseOutcome.RESPONSE_SUCCESS, seat, cards);
    }

    public static ResponseWindowResult failed(int seat, List<Card> cards) {
        return new ResponseWindowResult(ResponseOutcome.RESPONSE_FAILED, seat, cards);
    }

    public boolean isSuccess() {
        return outcome == ResponseOutcome.RESPONSE_SUCCESS;
    }
}
