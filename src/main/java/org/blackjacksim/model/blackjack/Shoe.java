package org.blackjacksim.model.blackjack;

import org.blackjacksim.exception.ShoeExhaustedException;

import java.util.*;

/**
 * Multi-deck shoe dealt from a cursor. Owned by a single simulation run.
 */
public class Shoe {
    public static final int CARDS_PER_DECK = 52;
    // below this many undealt cards a new round is not started on the current shoe
    static final int MIN_CARDS_FOR_ROUND = 20;

    private final List<Card> cards;
    private final int decks;
    private final double penetration;
    private final Random rnd;
    private final List<Runnable> reshuffleListeners = new ArrayList<>();
    private int cursor = 0;

    private Shoe(List<Card> cards, int decks, double penetration, Random rnd) {
        this.cards = cards;
        this.decks = decks;
        this.penetration = penetration;
        this.rnd = rnd;
    }

    /**
     * Builds {@code decks} ordered decks and shuffles them once.
     */
    public static Shoe build(int decks, double penetration, Random rnd) {
        if (decks < 1) throw new IllegalArgumentException("A shoe needs at least one deck");
        List<Card> tmp = new ArrayList<>(decks * CARDS_PER_DECK);
        for (int d = 0; d < decks; d++) {
            for (Card.Suit s : Card.Suit.values()) {
                for (Card.Rank r : Card.Rank.values()) tmp.add(new Card(r, s));
            }
        }
        Shoe shoe = new Shoe(tmp, decks, penetration, rnd);
        Collections.shuffle(shoe.cards, rnd);
        return shoe;
    }

    /**
     * Builds a shoe that deals the given cards in order, then whatever the shuffle gives after a reshuffle.
     */
    public static Shoe stacked(List<Card> ordered, double penetration, Random rnd) {
        int decks = Math.max(1, (ordered.size() + CARDS_PER_DECK - 1) / CARDS_PER_DECK);
        return new Shoe(new ArrayList<>(ordered), decks, penetration, rnd);
    }

    public Card dealOne() {
        if (cursor >= cards.size()) throw new ShoeExhaustedException(cards.size());
        return cards.get(cursor++);
    }

    public boolean needsReshuffle() {
        return (double) cursor / cards.size() > penetration
                || cards.size() - cursor < Math.min(MIN_CARDS_FOR_ROUND, cards.size());
    }

    public void reshuffle() {
        Collections.shuffle(cards, rnd);
        cursor = 0;
        for (Runnable l : reshuffleListeners) l.run();
    }

    public void onReshuffle(Runnable listener) {
        reshuffleListeners.add(listener);
    }

    public int size() { return cards.size(); }

    public int cursor() { return cursor; }

    public int remaining() { return cards.size() - cursor; }

    public int decks() { return decks; }
}
