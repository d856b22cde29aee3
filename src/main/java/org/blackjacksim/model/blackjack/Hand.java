package org.blackjacksim.model.blackjack;

import lombok.AccessLevel;
import lombok.Getter;
import org.blackjacksim.model.blackjack.rules.TableRules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A player or dealer hand for one round.
 */
@Getter
public class Hand {
    private final List<Card> cards = new ArrayList<>();
    private final boolean dealer;
    private final int splitDepth;
    private boolean splitHand;
    private boolean doubled;
    private boolean surrendered;
    private boolean standing;
    private double bet;

    @Getter(AccessLevel.NONE)
    private HandValue cachedValue;

    private Hand(boolean dealer, int splitDepth, double bet) {
        this.dealer = dealer;
        this.splitDepth = splitDepth;
        this.bet = bet;
    }

    public static Hand player(double bet) {
        return new Hand(false, 0, bet);
    }

    public static Hand dealer() {
        return new Hand(true, 0, 0);
    }

    public static Hand of(Card... cards) {
        Hand h = new Hand(false, 0, 0);
        for (Card c : cards) h.addCard(c);
        return h;
    }

    public List<Card> getCards() {
        return Collections.unmodifiableList(cards);
    }

    public void addCard(Card c) {
        cards.add(c);
        cachedValue = null;
    }

    public HandValue value() {
        if (cachedValue == null) {
            int hard = hardTotal();
            boolean hasAce = cards.stream().anyMatch(Card::isAce);
            cachedValue = hasAce && hard <= 11 ? new HandValue(hard + 10, true) : new HandValue(hard, false);
        }
        return cachedValue;
    }

    public int hardTotal() {
        int sum = 0;
        for (Card c : cards) sum += c.value();
        return sum;
    }

    public int bestTotal() {
        return value().total();
    }

    public boolean isBust() {
        return hardTotal() > 21;
    }

    public boolean isBlackjack() {
        return cards.size() == 2 && !splitHand && bestTotal() == 21;
    }

    public boolean isPair() {
        return cards.size() == 2 && cards.get(0).value() == cards.get(1).value();
    }

    public boolean canSplit() {
        return isPair();
    }

    public boolean canDouble(TableRules rules) {
        return cards.size() == 2 && (!splitHand || rules.isDoubleAfterSplit());
    }

    public boolean isFinished() {
        return standing || surrendered || isBust();
    }

    public Card upcard() {
        return cards.get(0);
    }

    /**
     * Moves the second card into a new hand carrying the same bet; both become split hands.
     */
    public Hand split() {
        if (!isPair()) throw new IllegalStateException("Hand " + cards + " is not a pair");
        Hand other = new Hand(false, splitDepth + 1, bet);
        other.addCard(cards.remove(1));
        other.splitHand = true;
        this.splitHand = true;
        cachedValue = null;
        return other;
    }

    public void doubleDown() {
        doubled = true;
        bet *= 2;
    }

    public void surrender() {
        surrendered = true;
    }

    public void stand() {
        standing = true;
    }

    @Override
    public String toString() {
        HandValue v = value();
        return cards + "=" + (v.soft() ? "soft " : "") + v.total();
    }
}
