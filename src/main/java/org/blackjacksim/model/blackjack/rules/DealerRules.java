package org.blackjacksim.model.blackjack.rules;

import org.blackjacksim.model.blackjack.Hand;
import org.blackjacksim.model.blackjack.HandValue;

public final class DealerRules {
    private DealerRules(){}

    public static boolean shouldHit(Hand dealer, TableRules rules) {
        HandValue v = dealer.value();
        if (v.total() < 17) return true;
        return v.total() == 17 && v.soft() && rules.isDealerHitsSoft17();
    }
}
