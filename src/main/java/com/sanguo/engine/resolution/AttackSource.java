package com.sanguo.engine.resolution;

import com.sanguo.engine.model.Card;

/**
 * The slash a dodge window answers.
 */
public record AttackSource(int attackerSeat, int defenderSeat, Card card) {
}
