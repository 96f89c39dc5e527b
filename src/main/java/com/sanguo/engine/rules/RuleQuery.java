package com.sanguo.engine.rules;

/**
 * The rule queries abilities may influence, each with its declared
 * combination policy.
 */
public enum RuleQuery {
    CAN_USE_CARD(CombinePolicy.OVERRIDE),
    CAN_RESPOND(CombinePolicy.OVERRIDE),
    VALIDATE_ACTION(CombinePolicy.OVERRIDE),
    MAX_USES_PER_TURN(CombinePolicy.OVERRIDE),
    ATTACK_DISTANCE(CombinePolicy.OVERRIDE),
    SEAT_DISTANCE(CombinePolicy.OVERRIDE),
    DRAW_COUNT(CombinePolicy.ADDITIVE);

    private final CombinePolicy policy;

    RuleQuery(CombinePolicy policy) {
        this.policy = policy;
    }

    public CombinePolicy getPolicy() {
        return policy;
    }
}
