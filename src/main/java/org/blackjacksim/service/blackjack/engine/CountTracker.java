package org.blackjacksim.service.blackjack.engine;

import lombok.extern.slf4j.Slf4j;
import org.blackjacksim.model.blackjack.Card;
import org.blackjacksim.model.blackjack.Shoe;

import java.util.function.ToIntFunction;

/**
 * Running and true count of one run, fed with the player-visible cards only.
 * Resets itself whenever the shoe it watches is reshuffled.
 */
@Slf4j
public class CountTracker {
    private final Shoe shoe;
    private final ToIntFunction<Card> weights;
    private int runningCount = 0;
    private int cardsSeen = 0;

    public CountTracker(Shoe shoe, ToIntFunction<Card> weights) {
        this.shoe = shoe;
        this.weights = weights;
        shoe.onReshuffle(this::reset);
    }

    public void observe(Card card) {
        runningCount += weights.applyAsInt(card);
        cardsSeen++;
    }

    public int runningCount() {
        return runningCount;
    }

    public int cardsSeen() {
        return cardsSeen;
    }

    public double decksRemaining() {
        return Math.max(1.0, (double) shoe.remaining() / Shoe.CARDS_PER_DECK);
    }

    public double trueCount() {
        return runningCount / decksRemaining();
    }

    public CountSnapshot snapshot() {
        return new CountSnapshot(runningCount, trueCount(), decksRemaining(), shoe.decks());
    }

    public void reset() {
        log.debug("Count reset after reshuffle (running={}, seen={})", runningCount, cardsSeen);
        runningCount = 0;
        cardsSeen = 0;
    }
}
