package com.sanguo.engine.abilities;

import com.sanguo.engine.rules.RuleModifier;

import java.util.EnumSet;

/**
 * Base for abilities whose whole effect is a rule modification.
 */
public abstract class RuleModifyingAbility extends BaseAbility implements RuleModifier {

    protected RuleModifyingAbility(String id, String name, AbilityType type) {
        super(id, name, type, EnumSet.of(AbilityCapability.MODIFIES_RULES));
    }
}
