package org.blackjacksim.model.blackjack;

import lombok.Builder;
import lombok.Value;

/**
 * Summary of every aggregated run of one strategy.
 */
@Value
@Builder
public class AggregateStats {
    String strategy;
    int requestedRuns;
    int aggregatedRuns;
    double totalNetProfit;
    double meanNetProfit;
    /** Net profit divided by the total amount wagered. */
    double profitPerUnitBet;
    double winRate;
    double pushRate;
    double lossRate;
    double averageHandsSurvived;
    double averageWinningsPerHand;
    long totalHands;
    long totalWins;
    long totalPushes;
    long totalLosses;
    long playerBlackjacks;
    int earlyEndings;
}
