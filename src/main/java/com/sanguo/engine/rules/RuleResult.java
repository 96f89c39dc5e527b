package com.sanguo.engine.rules;

/**
 * Outcome of a yes/no rule query.
 *
 * @param reason message key explaining a denial; null when allowed
 */
public record RuleResult(boolean allowed, String reason) {
    public static final RuleResult ALLOWED = new RuleResult(true, null);

    public static RuleResult deny(String reason) {
        return new RuleResult(false, reason);
    }
}
