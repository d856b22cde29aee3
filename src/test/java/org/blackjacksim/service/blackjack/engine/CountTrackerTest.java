package org.blackjacksim.service.blackjack.engine;

import org.blackjacksim.model.blackjack.Shoe;
import org.blackjacksim.service.blackjack.strategy.CountingSystem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Random;

import static org.assertj.core.api.Assertions.*;
import static org.blackjacksim.model.blackjack.Cards.card;

class CountTrackerTest {

    @ParameterizedTest
    @EnumSource(CountingSystem.class)
    void reshuffle_resetsRunningCount(CountingSystem system) {
        Shoe shoe = Shoe.build(2, 0.8, new Random(11));
        CountTracker tracker = new CountTracker(shoe, system::weight);
        for (int i = 0; i < 40; i++) tracker.observe(shoe.dealOne());

        shoe.reshuffle();

        assertThat(tracker.runningCount()).isZero();
        assertThat(tracker.cardsSeen()).isZero();
    }

    @ParameterizedTest
    @EnumSource(CountingSystem.class)
    void observe_wholeShoeSumsToImbalance(CountingSystem system) {
        Shoe shoe = Shoe.build(3, 1.0, new Random(5));
        CountTracker tracker = new CountTracker(shoe, system::weight);
        while (shoe.remaining() > 0) tracker.observe(shoe.dealOne());

        assertThat(tracker.runningCount()).isEqualTo(3 * system.imbalancePerDeck());
    }

    @Test
    void trueCount_dividesByDecksRemaining() {
        Shoe shoe = Shoe.build(6, 0.8, new Random(1));
        CountTracker tracker = new CountTracker(shoe, CountingSystem.HI_LO::weight);
        for (int i = 0; i < 52; i++) shoe.dealOne();
        for (int i = 0; i < 10; i++) tracker.observe(card("2H"));

        assertThat(tracker.decksRemaining()).isEqualTo(5.0);
        assertThat(tracker.trueCount()).isEqualTo(2.0);
        assertThat(tracker.snapshot().decksDealt()).isEqualTo(1.0);
    }

    @Test
    void decksRemaining_neverBelowOne() {
        Shoe shoe = Shoe.build(1, 1.0, new Random(1));
        CountTracker tracker = new CountTracker(shoe, CountingSystem.HI_LO::weight);
        for (int i = 0; i < 50; i++) shoe.dealOne();
        tracker.observe(card("5C"));

        assertThat(tracker.decksRemaining()).isEqualTo(1.0);
        assertThat(tracker.trueCount()).isEqualTo(1.0);
    }
}
