package org.blackjacksim.service.blackjack.strategy;

import org.blackjacksim.model.blackjack.Card;
import org.blackjacksim.model.blackjack.HandView;
import org.blackjacksim.model.blackjack.PlayDecision;
import org.blackjacksim.model.blackjack.rules.TableRules;
import org.blackjacksim.service.blackjack.engine.CountSnapshot;

import java.util.Objects;

/**
 * Basic strategy plus count deviations, with the bet ramped by a {@link BettingPolicy}.
 * Every built-in strategy is an instance of this class and differs only by its {@link CountingSystem}.
 * <p>
 * Unbalanced systems are converted to a balanced-equivalent count by removing the imbalance of the
 * decks already dealt, then every system is scaled to Hi-Lo units by its level.
 */
public class CountingStrategy implements Strategy {
    private final String name;
    private final CountingSystem system;
    private final BettingPolicy betting;
    private final DeviationTable deviations;
    private final double insuranceIndex;

    public CountingStrategy(CountingSystem system, BettingPolicy betting) {
        this(system.label(), system, betting, DeviationTable.illustrious18(), DeviationTable.INSURANCE_INDEX);
    }

    public CountingStrategy(String name, CountingSystem system, BettingPolicy betting,
                            DeviationTable deviations, double insuranceIndex) {
        this.name = Objects.requireNonNull(name, "name");
        this.system = Objects.requireNonNull(system, "system");
        this.betting = Objects.requireNonNull(betting, "betting");
        this.deviations = Objects.requireNonNull(deviations, "deviations");
        this.insuranceIndex = insuranceIndex;
    }

    @Override
    public String name() {
        return name;
    }

    public CountingSystem system() {
        return system;
    }

    /**
     * True count in Hi-Lo units.
     */
    public double normalizedCount(CountSnapshot count) {
        double running = count.runningCount() - system.imbalancePerDeck() * count.decksDealt();
        return running / Math.max(1.0, count.decksRemaining()) / system.level();
    }

    @Override
    public double betAmount(CountSnapshot count, TableRules rules, double bankroll) {
        return betting.bet(normalizedCount(count), rules.getMinBet(), bankroll);
    }

    @Override
    public PlayDecision playDecision(HandView hand, Card dealerUpcard, CountSnapshot count, TableRules rules) {
        int up = dealerUpcard.value();
        return deviations.find(hand, up, normalizedCount(count))
                .orElseGet(() -> BasicStrategyTable.decide(hand, up));
    }

    @Override
    public boolean insuranceDecision(CountSnapshot count) {
        return normalizedCount(count) >= insuranceIndex;
    }

    @Override
    public int cardWeight(Card card) {
        return system.weight(card);
    }

    @Override
    public String toString() {
        return name;
    }
}
