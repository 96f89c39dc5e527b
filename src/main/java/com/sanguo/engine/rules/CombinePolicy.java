package com.sanguo.engine.rules;

/**
 * How a modifier's value is folded into the running value of a rule query.
 */
public enum CombinePolicy {
    /** The supplied value replaces the running value. */
    OVERRIDE {
        @Override
        public int combine(int running, int supplied) {
            return supplied;
        }
    },
    /** The supplied value is a delta added to the running value. */
    ADDITIVE {
        @Override
        public int combine(int running, int supplied) {
            return running + supplied;
        }
    };

    public abstract int combine(int running, int supplied);
}
