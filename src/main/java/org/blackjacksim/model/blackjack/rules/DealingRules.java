package org.blackjacksim.model.blackjack.rules;

import org.blackjacksim.model.blackjack.Card;
import org.blackjacksim.model.blackjack.Hand;
import org.blackjacksim.model.blackjack.Shoe;

import java.util.function.Consumer;

public final class DealingRules {
    private DealingRules(){}

    /**
     * Player, dealer up, player, dealer hole. Every card but the hole card goes to {@code visible}.
     */
    public static void dealInitial(Shoe shoe, Hand player, Hand dealer, Consumer<Card> visible) {
        for (int i = 0; i < 2; i++) {
            Card p = shoe.dealOne();
            player.addCard(p);
            visible.accept(p);

            Card d = shoe.dealOne();
            dealer.addCard(d);
            if (i == 0) visible.accept(d);
        }
    }

    public static Card holeCard(Hand dealer) {
        return dealer.getCards().get(1);
    }
}
