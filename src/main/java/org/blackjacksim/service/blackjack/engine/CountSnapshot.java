package org.blackjacksim.service.blackjack.engine;

/**
 * What a strategy sees of the count when it is asked to bet or play.
 *
 * @param decksRemaining estimated undealt decks, never below 1
 * @param totalDecks     decks in the shoe
 */
public record CountSnapshot(int runningCount, double trueCount, double decksRemaining, int totalDecks) {

    public double decksDealt() {
        return Math.max(0, totalDecks - decksRemaining);
    }
}
