package org.blackjacksim.model.blackjack.rules;

import lombok.Builder;
import lombok.Value;

/**
 * Table limits and rule flags, fixed for the lifetime of a run.
 */
@Value
@Builder(toBuilder = true)
public class TableRules {
    @Builder.Default double tableBalance = Double.MAX_VALUE;
    @Builder.Default double minBet = 5;
    @Builder.Default double betMargin = 2.0;
    @Builder.Default int numDecks = 6;
    @Builder.Default double penetration = 0.8;
    boolean allowSurrender;
    boolean allowInsurance;
    boolean dealerHitsSoft17;
    @Builder.Default boolean doubleAfterSplit = true;
    @Builder.Default boolean splitAcesOneCard = true;
    /** Maximum number of hands a single starting hand may be split into. */
    @Builder.Default int maxSplitHands = 4;
    @Builder.Default double blackjackPayout = 1.5;

    /**
     * Most the house can pay out net on one opening bet: a natural, or every split hand doubled and won.
     */
    public double maxPayout(double bet) {
        int splitHands = Math.max(1, maxSplitHands);
        double perHand = doubleAfterSplit || splitHands == 1 ? 2 : 1;
        double multiple = Math.max(blackjackPayout, Math.max(2, splitHands * perHand));
        return bet * multiple;
    }

    public static TableRules defaults() {
        return TableRules.builder().build();
    }
}
