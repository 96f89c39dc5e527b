package com.sanguo.engine.abilities.equipment;

import com.sanguo.engine.abilities.AbilityType;
import com.sanguo.engine.abilities.RuleModifyingAbility;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

import java.util.OptionalInt;

/**
 * Weapon setting its owner's attack distance.
 */
public class LongWeaponAbility extends RuleModifyingAbility {
    private final int range;

    public LongWeaponAbility(String id, String name, int range) {
        super(id, name, AbilityType.LOCKED);
        if (range < 1) {
            throw new IllegalArgumentException("Weapon range must be at least 1, got " + range);
        }
        this.range = range;
    }

    public int getRange() {
        return range;
    }

    @Override
    public OptionalInt modifyAttackDistance(Game game, Player attacker, Player defender, int current) {
        return isOwner(attacker) ? OptionalInt.of(range) : OptionalInt.empty();
    }
}
