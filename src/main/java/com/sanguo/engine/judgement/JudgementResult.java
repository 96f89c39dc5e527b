package com.sanguo.engine.judgement;

import com.sanguo.engine.model.Card;

public record JudgementResult(int ownerSeat, JudgementRequest request, Card card, boolean success) {
}
