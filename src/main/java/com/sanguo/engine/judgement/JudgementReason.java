package com.sanguo.engine.judgement;

/**
 * Why a judgement is performed.
 */
public enum JudgementReason {
    EVADE,
    RETALIATION,
    DELAYED_TRICK,
    ABILITY
}
