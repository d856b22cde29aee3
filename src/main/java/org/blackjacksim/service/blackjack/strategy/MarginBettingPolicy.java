package org.blackjacksim.service.blackjack.strategy;

/**
 * Flat minimum bet at or below the threshold, then one extra {@code margin} times the minimum
 * for every whole point of true count above it.
 */
public record MarginBettingPolicy(double margin, int threshold) implements BettingPolicy {

    public MarginBettingPolicy {
        if (margin < 0) throw new IllegalArgumentException("margin must not be negative");
    }

    @Override
    public double bet(double trueCount, double minBet, double bankroll) {
        double units = Math.max(0, Math.floor(trueCount) - threshold);
        return Math.min(bankroll, minBet * (1 + margin * units));
    }
}
