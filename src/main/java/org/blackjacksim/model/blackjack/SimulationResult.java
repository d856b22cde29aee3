package org.blackjacksim.model.blackjack;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one (strategy, run) pair.
 */
@Value
@Builder
public class SimulationResult {
    String strategy;
    int runIndex;
    long seed;
    double startingBalance;
    double endingBalance;
    int handsPlayed;
    TerminalReason terminalReason;
    int wins;
    int pushes;
    int losses;
    int playerBlackjacks;
    double totalWagered;

    public double netProfit() {
        return endingBalance - startingBalance;
    }

    public boolean endedEarly() {
        return terminalReason != TerminalReason.HAND_LIMIT_REACHED;
    }
}
