package org.blackjacksim.service.blackjack.strategy;

@FunctionalInterface
public interface BettingPolicy {
    /**
     * @param trueCount count in Hi-Lo units
     */
    double bet(double trueCount, double minBet, double bankroll);
}
