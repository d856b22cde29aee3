package org.blackjacksim.model.blackjack;

import java.util.List;

/**
 * Read-only picture of the active hand handed to a strategy, with the plays the table allows right now.
 */
public record HandView(
        List<Card> cards,
        HandValue value,
        boolean splitHand,
        boolean canSplit,
        boolean canDouble,
        boolean canSurrender
) {
    public static HandView of(Hand hand, boolean canSplit, boolean canDouble, boolean canSurrender) {
        return new HandView(List.copyOf(hand.getCards()), hand.value(), hand.isSplitHand(),
                canSplit, canDouble, canSurrender);
    }

    public int hardTotal() {
        return cards.stream().mapToInt(Card::value).sum();
    }

    public boolean isPair() {
        return cards.size() == 2 && cards.get(0).value() == cards.get(1).value();
    }

    public boolean allows(PlayDecision decision) {
        return switch (decision) {
            case HIT, STAND -> true;
            case DOUBLE -> canDouble;
            case SPLIT -> canSplit;
            case SURRENDER -> canSurrender;
        };
    }
}
