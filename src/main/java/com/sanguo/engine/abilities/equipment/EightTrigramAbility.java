package com.sanguo.engine.abilities.equipment;

import com.sanguo.engine.abilities.AbilityCapability;
import com.sanguo.engine.abilities.AbilityType;
import com.sanguo.engine.abilities.ArmorAbility;
import com.sanguo.engine.abilities.BaseAbility;
import com.sanguo.engine.abilities.EvadeJudgementAbility;
import com.sanguo.engine.judgement.JudgementRule;
import com.sanguo.engine.judgement.JudgementRules;

import java.util.EnumSet;

/**
 * Armor: when a dodge is needed, a red judgement counts as one.
 */
public class EightTrigramAbility extends BaseAbility implements EvadeJudgementAbility, ArmorAbility {
    public static final String ID = "bagua_array";

    public EightTrigramAbility() {
        super(ID, "Eight Trigram Array", AbilityType.TRIGGER, EnumSet.of(AbilityCapability.INTERVENES_RESOLUTION));
    }

    @Override
    public JudgementRule evadeRule() {
        return JudgementRules.red();
    }
}
