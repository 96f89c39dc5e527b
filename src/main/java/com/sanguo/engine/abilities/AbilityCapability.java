package com.sanguo.engine.abilities;

/**
 * What an ability takes part in. The rule aggregator only consults
 * abilities declaring {@link #MODIFIES_RULES}.
 */
public enum AbilityCapability {
    PROVIDES_ACTIONS,
    MODIFIES_RULES,
    INTERVENES_RESOLUTION,
    INITIATES_CHOICES
}
