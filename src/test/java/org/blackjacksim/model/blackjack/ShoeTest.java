package org.blackjacksim.model.blackjack;

import org.blackjacksim.exception.ShoeExhaustedException;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;
import static org.blackjacksim.model.blackjack.Cards.cards;

class ShoeTest {

    private static Map<Card, Long> multiset(List<Card> cards) {
        return cards.stream().collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
    }

    private static List<Card> dealAll(Shoe shoe) {
        List<Card> out = new ArrayList<>();
        for (int i = 0; i < shoe.size(); i++) out.add(shoe.dealOne());
        return out;
    }

    @Test
    void build_containsEveryCardOncePerDeck() {
        Shoe shoe = Shoe.build(6, 0.8, new Random(1));

        assertThat(shoe.size()).isEqualTo(6 * 52);
        Map<Card, Long> counts = multiset(dealAll(shoe));
        assertThat(counts).hasSize(52);
        assertThat(counts.values()).allMatch(n -> n == 6);
    }

    @Test
    void build_sameSeed_sameOrder() {
        List<Card> a = dealAll(Shoe.build(2, 0.8, new Random(42)));
        List<Card> b = dealAll(Shoe.build(2, 0.8, new Random(42)));

        assertThat(a).isEqualTo(b);
    }

    @Test
    void build_zeroDecks_rejected() {
        assertThatThrownBy(() -> Shoe.build(0, 0.8, new Random()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void dealOne_pastTheEnd_throwsShoeExhausted() {
        Shoe shoe = Shoe.stacked(cards("AH", "KS"), 1.0, new Random(1));
        shoe.dealOne();
        shoe.dealOne();

        assertThatThrownBy(shoe::dealOne).isInstanceOf(ShoeExhaustedException.class);
    }

    @Test
    void reshuffle_preservesCardsAndResetsCursor() {
        Shoe shoe = Shoe.build(1, 0.75, new Random(7));
        Map<Card, Long> before = multiset(dealAll(Shoe.build(1, 0.75, new Random(7))));
        for (int i = 0; i < 30; i++) shoe.dealOne();

        shoe.reshuffle();

        assertThat(shoe.cursor()).isZero();
        assertThat(shoe.remaining()).isEqualTo(52);
        assertThat(multiset(dealAll(shoe))).isEqualTo(before);
    }

    @Test
    void reshuffle_notifiesListeners() {
        Shoe shoe = Shoe.build(1, 0.75, new Random(7));
        List<String> calls = new ArrayList<>();
        shoe.onReshuffle(() -> calls.add("reset"));

        shoe.reshuffle();
        shoe.reshuffle();

        assertThat(calls).hasSize(2);
    }

    @Test
    void needsReshuffle_onlyOncePenetrationIsPassed() {
        Shoe shoe = Shoe.build(2, 0.5, new Random(3));
        for (int i = 0; i < 52; i++) shoe.dealOne();
        assertThat(shoe.needsReshuffle()).isFalse();

        shoe.dealOne();
        assertThat(shoe.needsReshuffle()).isTrue();
    }

    @Test
    void needsReshuffle_whenTooFewCardsLeftForARound() {
        Shoe shoe = Shoe.build(1, 1.0, new Random(3));
        for (int i = 0; i < 52 - Shoe.MIN_CARDS_FOR_ROUND; i++) shoe.dealOne();
        assertThat(shoe.needsReshuffle()).isFalse();

        shoe.dealOne();
        assertThat(shoe.needsReshuffle()).isTrue();
    }
}
