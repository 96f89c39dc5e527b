package com.sanguo.engine.judgement;

import com.sanguo.engine.model.Card;

/**
 * Predicate deciding whether a judgement card counts as a success.
 */
@FunctionalInterface
public interface JudgementRule {

    boolean isSuccess(Card card);

    default String describe() {
        return getClass().getSimpleName();
    }
}
