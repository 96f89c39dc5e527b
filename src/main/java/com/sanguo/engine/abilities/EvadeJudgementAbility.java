package com.sanguo.engine.abilities;

import com.sanguo.engine.judgement.JudgementRule;

/**
 * Lets its owner try a judgement in place of playing a dodge.
 */
public interface EvadeJudgementAbility {

    /**
     * Rule under which the judgement counts as a dodge.
     */
    JudgementRule evadeRule();
}
