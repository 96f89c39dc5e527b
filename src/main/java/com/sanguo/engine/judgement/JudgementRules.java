package com.sanguo.engine.judgement;

import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Suit;

/**
 * Stock judgement rules.
 */
public final class JudgementRules {

    private JudgementRules() {
        // Utility class - prevent instantiation
    }

    public static JudgementRule red() {
        return named("red", Card::isRed);
    }

    public static JudgementRule black() {
        return named("black", Card::isBlack);
    }

    public static JudgementRule suit(Suit suit) {
        return named(suit.getJsonValue(), card -> card.suit() == suit);
    }

    public static JudgementRule not(JudgementRule rule) {
        return named("not " + rule.describe(), card -> !rule.isSuccess(card));
    }

    private static JudgementRule named(String description, JudgementRule rule) {
        return new JudgementRule() {
            @Override
            public boolean isSuccess(Card card) {
                return rule.isSuccess(card);
            }

            @Override
            public String describe() {
                return description;
            }
        };
    }
}
