package org.blackjacksim.model.blackjack.rules;

import org.blackjacksim.model.blackjack.Hand;
import org.blackjacksim.model.blackjack.HandView;
import org.blackjacksim.model.blackjack.PlayDecision;
import org.blackjacksim.model.blackjack.PlayerAccount;

/**
 * Which plays are legal for a player hand at a given moment.
 */
public final class HandRules {
    private HandRules(){}

    public static boolean canSplit(Hand h, int handsInRound, TableRules rules, PlayerAccount account) {
        return h.canSplit()
                && handsInRound < rules.getMaxSplitHands()
                && account.canCover(h.getBet());
    }

    public static boolean canDouble(Hand h, TableRules rules, PlayerAccount account) {
        return h.canDouble(rules) && account.canCover(h.getBet());
    }

    /** Late surrender, first decision of an unsplit hand only. */
    public static boolean canSurrender(Hand h, TableRules rules) {
        return rules.isAllowSurrender() && h.getCards().size() == 2 && !h.isSplitHand();
    }

    public static HandView view(Hand h, int handsInRound, TableRules rules, PlayerAccount account) {
        return HandView.of(h,
                canSplit(h, handsInRound, rules, account),
                canDouble(h, rules, account),
                canSurrender(h, rules));
    }

    /** Replaces an illegal play by STAND. */
    public static PlayDecision normalize(PlayDecision requested, HandView view) {
        if (requested == null || !view.allows(requested)) return PlayDecision.STAND;
        return requested;
    }
}
