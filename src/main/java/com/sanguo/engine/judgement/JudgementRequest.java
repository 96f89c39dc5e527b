package com.sanguo.engine.judgement;

import java.util.Objects;

/**
 * @param sourceId id of the ability or card asking for the judgement
 */
public record JudgementRequest(String sourceId, JudgementReason reason, JudgementRule rule) {
    public JudgementRequest {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(reason, "reason");
    }
}
