package org.blackjacksim.service.blackjack.engine;

import org.blackjacksim.model.blackjack.HandOutcome;
import org.blackjacksim.model.blackjack.TerminalReason;

import java.util.List;

/**
 * What one round did to the run. {@code stopReason} is set when no round could be played.
 */
public record RoundResult(
        TerminalReason stopReason,
        List<HandOutcome> outcomes,
        int playerBlackjacks,
        double net
) {
    public static RoundResult stopped(TerminalReason reason) {
        return new RoundResult(reason, List.of(), 0, 0);
    }

    public boolean played() {
        return stopReason == null;
    }

    public int wins() {
        return count(HandOutcome.WIN) + count(HandOutcome.BLACKJACK);
    }

    public int pushes() {
        return count(HandOutcome.PUSH);
    }

    public int losses() {
        return count(HandOutcome.LOSE) + count(HandOutcome.SURRENDER);
    }

    private int count(HandOutcome o) {
        return (int) outcomes.stream().filter(x -> x == o).count();
    }
}
