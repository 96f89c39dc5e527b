package com.sanguo.engine.resolution;

public enum ResolutionErrorCode {
    INVALID_TARGET,
    CARD_NOT_FOUND,
    TARGET_NOT_ALIVE,
    INVALID_STATE,
    RULE_VALIDATION_FAILED
}
