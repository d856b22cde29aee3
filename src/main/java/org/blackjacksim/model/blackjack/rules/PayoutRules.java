package org.blackjacksim.model.blackjack.rules;

import org.blackjacksim.model.blackjack.Hand;
import org.blackjacksim.model.blackjack.HandOutcome;

public final class PayoutRules {
    private PayoutRules(){}

    /**
     * @param credit amount returned to the player, stake included
     */
    public record Outcome(double credit, HandOutcome outcome) {
        public double net(double bet) {
            return credit - bet;
        }
    }

    public static Outcome compute(Hand player, Hand dealer, TableRules rules) {
        double bet = player.getBet();
        if (player.isSurrendered()) return new Outcome(bet / 2, HandOutcome.SURRENDER);
        if (player.isBust()) return new Outcome(0, HandOutcome.LOSE);
        boolean pBJ = player.isBlackjack(), dBJ = dealer.isBlackjack();
        if (pBJ && dBJ) return new Outcome(bet, HandOutcome.PUSH);
        if (pBJ) return new Outcome(bet + bet * rules.getBlackjackPayout(), HandOutcome.BLACKJACK);
        if (dBJ) return new Outcome(0, HandOutcome.LOSE);
        int pt = player.bestTotal(), dt = dealer.bestTotal();
        if (dealer.isBust() || pt > dt) return new Outcome(bet * 2, HandOutcome.WIN);
        if (pt == dt) return new Outcome(bet, HandOutcome.PUSH);
        return new Outcome(0, HandOutcome.LOSE);
    }

    public static Outcome insurance(double insuranceBet, Hand dealer) {
        if (insuranceBet <= 0) return new Outcome(0, HandOutcome.PUSH);
        return dealer.isBlackjack()
                ? new Outcome(insuranceBet * 3, HandOutcome.WIN)
                : new Outcome(0, HandOutcome.LOSE);
    }
}
