package org.blackjacksim.service.blackjack.strategy;

import org.blackjacksim.model.blackjack.Card;
import org.blackjacksim.model.blackjack.HandView;
import org.blackjacksim.model.blackjack.PlayDecision;
import org.blackjacksim.model.blackjack.rules.TableRules;
import org.blackjacksim.service.blackjack.engine.CountSnapshot;

/**
 * A card counting strategy: how much to bet, how to play, whether to insure and how to weigh each card.
 * <p>
 * One instance is shared by every run of the strategy, possibly from several worker threads at once,
 * so implementations must not keep per-run state. The count itself lives in the engine.
 * <p>
 * The engine does not trust the answers: bets are clamped to the table minimum and the
 * player's balance, and a play the hand does not allow is replaced by {@link PlayDecision#STAND}.
 */
public interface Strategy {

    /** Unique name, used to group results. */
    String name();

    double betAmount(CountSnapshot count, TableRules rules, double bankroll);

    PlayDecision playDecision(HandView hand, Card dealerUpcard, CountSnapshot count, TableRules rules);

    /** Only asked when the dealer shows an ace and the table offers insurance. */
    boolean insuranceDecision(CountSnapshot count);

    int cardWeight(Card card);
}
