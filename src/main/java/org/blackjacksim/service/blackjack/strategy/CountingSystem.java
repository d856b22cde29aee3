package org.blackjacksim.service.blackjack.strategy;

import org.blackjacksim.model.blackjack.Card;

/**
 * Card weight tables of the built-in counting systems.
 * <p>
 * Weights are indexed by hard card value: {@code [A, 2, 3, 4, 5, 6, 7, 8, 9, 10]}.
 * {@code level} converts the system's true count to Hi-Lo units so that the same betting
 * ramp and play indices can be shared (Wong Halves is stored doubled, hence level 2).
 */
public enum CountingSystem {
    HI_LO("Hi-Lo", 1, -1, 1, 1, 1, 1, 1, 0, 0, 0, -1),
    KO("Knock-Out", 1, -1, 1, 1, 1, 1, 1, 1, 0, 0, -1),
    HI_OPT_I("Hi-Opt I", 1, 0, 0, 1, 1, 1, 1, 0, 0, 0, -1),
    HI_OPT_II("Hi-Opt II", 2, 0, 1, 1, 2, 2, 1, 1, 0, 0, -2),
    OMEGA_II("Omega II", 2, 0, 1, 1, 2, 2, 2, 1, 0, -1, -2),
    ZEN_COUNT("Zen Count", 2, -1, 1, 1, 2, 2, 2, 1, 0, 0, -2),
    UNBALANCED_ZEN_2("Unbalanced Zen 2", 2, -1, 1, 2, 2, 2, 2, 1, 0, 0, -2),
    WONG_HALVES("Wong Halves", 2, -2, 1, 2, 2, 3, 2, 1, 0, -1, -2),
    ACE_FIVE("Ace-Five", 1, -1, 0, 0, 0, 1, 0, 0, 0, 0, 0),
    SILVER_FOX("Silver Fox", 1, -1, 1, 1, 1, 1, 1, 1, 0, -1, -1),
    J_NOIR("J. Noir", 2, 1, 1, 1, 1, 1, 1, 1, 1, 1, -2),
    RED_SEVEN("Red Seven", 1, -1, 1, 1, 1, 1, 1, 0, 0, 0, -1) {
        @Override
        public int weight(Card card) {
            if (card.getRank() == Card.Rank.SEVEN) return card.isRed() ? 1 : 0;
            return super.weight(card);
        }
    },
    KISS("KISS", 1, 0, 0, 1, 1, 1, 1, 0, 0, 0, -1),
    KISS_II("KISS II", 1, 0, 0, 1, 1, 1, 1, 0, 0, 0, -1) {
        @Override
        public int weight(Card card) {
            if (card.getRank() == Card.Rank.TWO) return card.isRed() ? 0 : 1;
            return super.weight(card);
        }
    },
    KISS_III("KISS III", 1, -1, 0, 1, 1, 1, 1, 1, 0, 0, -1) {
        @Override
        public int weight(Card card) {
            if (card.getRank() == Card.Rank.TWO) return card.isRed() ? 0 : 1;
            return super.weight(card);
        }
    };

    private final String label;
    private final int level;
    private final int[] weights;

    CountingSystem(String label, int level, int... weights) {
        if (weights.length != 10) throw new IllegalArgumentException(label + ": expected 10 weights");
        this.label = label;
        this.level = level;
        this.weights = weights;
    }

    public String label() {
        return label;
    }

    public int level() {
        return level;
    }

    public int weight(Card card) {
        return weights[card.value() - 1];
    }

    /**
     * Sum of the weights over one 52 card deck. Zero for balanced systems.
     */
    public int imbalancePerDeck() {
        int sum = 0;
        for (Card.Suit s : Card.Suit.values()) {
            for (Card.Rank r : Card.Rank.values()) sum += weight(new Card(r, s));
        }
        return sum;
    }

    public boolean isBalanced() {
        return imbalancePerDeck() == 0;
    }
}
