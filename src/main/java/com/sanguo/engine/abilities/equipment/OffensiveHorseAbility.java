package com.sanguo.engine.abilities.equipment;

import com.sanguo.engine.abilities.AbilityType;
import com.sanguo.engine.abilities.RuleModifyingAbility;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

import java.util.OptionalInt;

/**
 * Others are one seat closer to the owner, never closer than one.
 */
public class OffensiveHorseAbility extends RuleModifyingAbility {

    public OffensiveHorseAbility(String id, String name) {
        super(id, name, AbilityType.LOCKED);
    }

    @Override
    public OptionalInt modifySeatDistance(Game game, Player from, Player to, int current) {
        if (isOwner(from) && !isOwner(to)) {
            return OptionalInt.of(Math.max(1, current - 1));
        }
        return OptionalInt.empty();
    }
}
