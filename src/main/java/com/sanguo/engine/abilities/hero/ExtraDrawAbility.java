package com.sanguo.engine.abilities.hero;

import com.sanguo.engine.abilities.AbilityType;
import com.sanguo.engine.abilities.RuleModifyingAbility;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

import java.util.OptionalInt;

/**
 * Draws extra cards in the draw phase. Several instances stack.
 */
public class ExtraDrawAbility extends RuleModifyingAbility {
    public static final String ID = "extra_draw";

    private final int bonus;

    public ExtraDrawAbility() {
        this(ID, 1);
    }

    public ExtraDrawAbility(String id, int bonus) {
        super(id, "Heroic Posture", AbilityType.LOCKED);
        this.bonus = bonus;
    }

    @Override
    public OptionalInt modifyDrawCount(Game game, Player player, int current) {
        return isOwner(player) ? OptionalInt.of(bonus) : OptionalInt.empty();
    }
}
