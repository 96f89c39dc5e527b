package com.sanguo.engine.abilities.equipment;

import com.sanguo.engine.abilities.AbilityType;
import com.sanguo.engine.abilities.RuleModifyingAbility;
import com.sanguo.engine.model.CardSubType;
import com.sanguo.engine.rules.CardUsageContext;

import java.util.OptionalInt;

/**
 * Weapon lifting the per-turn slash limit.
 */
public class CrossbowAbility extends RuleModifyingAbility {
    public static final String ID = "zhuge_crossbow";

    public CrossbowAbility() {
        super(ID, "Zhuge Crossbow", AbilityType.LOCKED);
    }

    @Override
    public OptionalInt modifyMaxUsesPerTurn(CardUsageContext context, int current) {
        if (isOwner(context.user()) && context.card().is(CardSubType.SLASH)) {
            return OptionalInt.of(Integer.MAX_VALUE);
        }
        return OptionalInt.empty();
    }
}
