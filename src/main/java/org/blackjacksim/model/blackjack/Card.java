package org.blackjacksim.model.blackjack;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
public class Card {
    private final Rank rank;
    private final Suit suit;

    /**
     * Hard blackjack value: aces count 1 here, the soft bonus is applied by the hand.
     */
    public int value() {
        return switch (rank) {
            case ACE -> 1;
            case TWO -> 2; case THREE -> 3; case FOUR -> 4; case FIVE -> 5; case SIX -> 6;
            case SEVEN -> 7; case EIGHT -> 8; case NINE -> 9; case TEN, JACK, QUEEN, KING -> 10;
        };
    }

    public boolean isAce() {
        return rank == Rank.ACE;
    }

    public boolean isRed() {
        return suit == Suit.HEARTS || suit == Suit.DIAMONDS;
    }

    @Override
    public String toString() {
        return rank.symbol + suit.symbol;
    }

    public enum Suit {
        CLUBS("C"), DIAMONDS("D"), HEARTS("H"), SPADES("S");

        private final String symbol;

        Suit(String symbol) { this.symbol = symbol; }
    }

    public enum Rank {
        ACE("A"), TWO("2"), THREE("3"), FOUR("4"), FIVE("5"), SIX("6"), SEVEN("7"),
        EIGHT("8"), NINE("9"), TEN("T"), JACK("J"), QUEEN("Q"), KING("K");

        private final String symbol;

        Rank(String symbol) { this.symbol = symbol; }
    }
}
