package org.blackjacksim.service.blackjack.strategy;

import org.blackjacksim.model.blackjack.HandValue;
import org.blackjacksim.model.blackjack.HandView;
import org.blackjacksim.model.blackjack.PlayDecision;

/**
 * Count-independent play table (multi-deck, dealer stands on soft 17).
 * Dealer upcard values run 1 (ace) to 10.
 */
public final class BasicStrategyTable {
    private BasicStrategyTable(){}

    public static PlayDecision decide(HandView hand, int up) {
        HandValue v = hand.value();
        int hard = hand.hardTotal();

        if (splits(hand, up)) return PlayDecision.SPLIT;
        if (hand.canSurrender() && !v.soft() && surrender(hard, up)) return PlayDecision.SURRENDER;
        if (v.soft()) return soft(v.total(), up, hand.canDouble());
        return hard(v.total(), up, hand.canDouble());
    }

    /** True when the hand may be split and the table splits this pair against {@code up}. */
    static boolean splits(HandView hand, int up) {
        return hand.canSplit() && hand.isPair() && split(hand.hardTotal(), up);
    }

    static boolean surrender(int hard, int up) {
        return (hard == 15 && up == 10) || (hard == 16 && (up == 9 || up == 10 || up == 1));
    }

    /**
     * @param pairTotal hard total of the pair, so A-A is 2
     */
    static boolean split(int pairTotal, int up) {
        return switch (pairTotal) {
            case 2, 16 -> true;
            case 4, 6, 14 -> up >= 2 && up <= 7;
            case 8 -> up == 5 || up == 6;
            case 12 -> up >= 2 && up <= 6;
            case 18 -> (up >= 2 && up <= 6) || up == 8 || up == 9;
            default -> false;
        };
    }

    static PlayDecision soft(int total, int up, boolean canDouble) {
        if (total >= 19) return PlayDecision.STAND;
        if (total == 18) {
            if (up >= 2 && up <= 6) return canDouble ? PlayDecision.DOUBLE : PlayDecision.STAND;
            return up == 7 || up == 8 ? PlayDecision.STAND : PlayDecision.HIT;
        }
        if (total == 17 && up >= 3 && up <= 6) return doubleOrHit(canDouble);
        if ((total == 15 || total == 16) && up >= 4 && up <= 6) return doubleOrHit(canDouble);
        if ((total == 13 || total == 14) && (up == 5 || up == 6)) return doubleOrHit(canDouble);
        return PlayDecision.HIT;
    }

    static PlayDecision hard(int total, int up, boolean canDouble) {
        if (total >= 17) return PlayDecision.STAND;
        if (total >= 13) return up >= 2 && up <= 6 ? PlayDecision.STAND : PlayDecision.HIT;
        if (total == 12) return up >= 4 && up <= 6 ? PlayDecision.STAND : PlayDecision.HIT;
        if (total == 11) return doubleOrHit(canDouble);
        if (total == 10) return up >= 2 && up <= 9 ? doubleOrHit(canDouble) : PlayDecision.HIT;
        if (total == 9) return up >= 3 && up <= 6 ? doubleOrHit(canDouble) : PlayDecision.HIT;
        return PlayDecision.HIT;
    }

    private static PlayDecision doubleOrHit(boolean canDouble) {
        return canDouble ? PlayDecision.DOUBLE : PlayDecision.HIT;
    }
}
