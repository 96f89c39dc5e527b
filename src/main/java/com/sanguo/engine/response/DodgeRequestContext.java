package com.sanguo.engine.response;

import com.sanguo.engine.model.Card;
import com.sanguo.engine.resolution.AttackSource;

import java.util.Objects;

/**
 * Mutable state of one request for a dodge, shared by the providers that
 * try to satisfy it.
 */
public class DodgeRequestContext {
    private final AttackSource source;
    private final int requiredCount;
    private boolean resolved;
    private String resolvedBy;
    private Card providedCard;
    private boolean highPriorityActivated;
    private boolean assistanceAttempted;

    public DodgeRequestContext(AttackSource source, int requiredCount) {
        this.source = source;
        this.requiredCount = requiredCount;
    }

    public AttackSource getSource() {
        return source;
    }

    public int getAttackerSeat() {
        return source.attackerSeat();
    }

    public int getDefenderSeat() {
        return source.defenderSeat();
    }

    public int getRequiredCount() {
        return requiredCount;
    }

    public boolean isResolved() {
        return resolved;
    }

    /**
     * Id of the provider or ability that produced the dodge, or null.
     */
    public String getResolvedBy() {
        return resolvedBy;
    }

    /**
     * Card that counted as the dodge: a played dodge or a judged card. Null
     * until resolved.
     */
    public Card getProvidedCard() {
        return providedCard;
    }

    /**
     * Record the one dodge that satisfies this request.
     * @throws IllegalStateException if another provider already resolved it
     */
    public void markResolved(String by, Card card) {
        Objects.requireNonNull(by, "by");
        Objects.requireNonNull(card, "card");
        if (resolved) {
            throw new IllegalStateException("Dodge request against seat " + getDefenderSeat()
                    + " was already resolved by " + resolvedBy);
        }
        this.resolved = true;
        this.resolvedBy = by;
        this.providedCard = card;
    }

    public boolean isHighPriorityActivated() {
        return highPriorityActivated;
    }

    public void setHighPriorityActivated(boolean highPriorityActivated) {
        this.highPriorityActivated = highPriorityActivated;
    }

    public boolean isAssistanceAttempted() {
        return assistanceAttempted;
    }

    public void setAssistanceAttempted(boolean assistanceAttempted) {
        this.assistanceAttempted = assistanceAttempted;
    }
}
