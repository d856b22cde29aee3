package org.blackjacksim.service.blackjack.strategy;

import org.blackjacksim.model.blackjack.HandView;
import org.blackjacksim.model.blackjack.PlayDecision;

/**
 * Count-triggered departure from basic strategy.
 *
 * @param total      hard total of the hand (for pairs, the pair's total)
 * @param dealerUp   dealer upcard value, ace = 1
 * @param index      true count (Hi-Lo units) at which the deviation applies
 * @param atOrAbove  applies when {@code trueCount >= index}, otherwise when {@code trueCount <= index}
 */
public record Deviation(Kind kind, int total, int dealerUp, double index, boolean atOrAbove, PlayDecision play) {

    public enum Kind { HARD, PAIR, SURRENDER }

    public static Deviation above(Kind kind, int total, int dealerUp, double index, PlayDecision play) {
        return new Deviation(kind, total, dealerUp, index, true, play);
    }

    public static Deviation below(Kind kind, int total, int dealerUp, double index, PlayDecision play) {
        return new Deviation(kind, total, dealerUp, index, false, play);
    }

    public boolean matches(HandView hand, int up, double trueCount) {
        if (up != dealerUp) return false;
        // total-based indices do not apply to a pair that is going to be split
        if (kind != Kind.PAIR && BasicStrategyTable.splits(hand, up)) return false;
        boolean shape = switch (kind) {
            case PAIR -> hand.isPair() && hand.hardTotal() == total;
            case HARD -> !hand.value().soft() && hand.value().total() == total;
            case SURRENDER -> hand.canSurrender() && !hand.value().soft() && hand.value().total() == total;
        };
        if (!shape) return false;
        return atOrAbove ? trueCount >= index : trueCount <= index;
    }
}
