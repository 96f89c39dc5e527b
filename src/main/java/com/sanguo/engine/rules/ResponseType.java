package com.sanguo.engine.rules;

import com.sanguo.engine.model.CardSubType;

/**
 * What a response window asks for, and which card kind answers it.
 */
public enum ResponseType {
    JINK_AGAINST_SLASH(CardSubType.DODGE),
    JINK_AGAINST_VOLLEY(CardSubType.DODGE),
    SLASH_AGAINST_INVASION(CardSubType.SLASH),
    PEACH_FOR_DYING(CardSubType.PEACH);

    private final CardSubType answeredBy;

    ResponseType(CardSubType answeredBy) {
        this.answeredBy = answeredBy;
    }

    public CardSubType getAnsweredBy() {
        return answeredBy;
    }
}
