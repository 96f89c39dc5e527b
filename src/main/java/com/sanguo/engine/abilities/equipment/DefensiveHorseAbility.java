package com.sanguo.engine.abilities.equipment;

import com.sanguo.engine.abilities.AbilityType;
import com.sanguo.engine.abilities.RuleModifyingAbility;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

import java.util.OptionalInt;

/**
 * Others are one seat further from the owner.
 */
public class DefensiveHorseAbility extends RuleModifyingAbility {

    public DefensiveHorseAbility(String id, String name) {
        super(id, name, AbilityType.LOCKED);
    }

    @Override
    public OptionalInt modifySeatDistance(Game game, Player from, Player to, int current) {
        if (isOwner(to) && !isOwner(from)) {
            return OptionalInt.of(current + 1);
        }
        return OptionalInt.empty();
    }
}
