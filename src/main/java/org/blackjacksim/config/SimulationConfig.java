package org.blackjacksim.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.blackjacksim.exception.ConfigurationException;
import org.blackjacksim.model.blackjack.rules.TableRules;

import java.util.List;

/**
 * Everything one simulation batch needs. Built once, read by every worker, never modified.
 */
@Value
@Builder(toBuilder = true)
public class SimulationConfig {
    @Builder.Default double tableBalance = Double.MAX_VALUE;
    @Builder.Default double playerBalance = 500;
    @Builder.Default int numDecks = 6;
    @Builder.Default int numSimulationsPerStrategy = 100;
    @Builder.Default int maxHands = 200;
    @Builder.Default double minBet = 5;
    @Builder.Default double betMargin = 2.0;
    /** True count (Hi-Lo units) above which the bet starts to ramp. */
    @Builder.Default int betThreshold = 1;
    boolean allowSurrender;
    boolean allowInsurance;
    boolean dealerHitsSoft17;
    @Builder.Default boolean showPerSimulationOutput = true;
    /** Empty means every built-in strategy. */
    @Singular List<String> strategies;
    /** Null means standard output. */
    String outputFile;
    @Builder.Default double penetration = 0.8;
    @Builder.Default int maxSplitHands = 4;
    @Builder.Default boolean doubleAfterSplit = true;
    /** 0 means one worker per available processor. */
    int workerThreads;
    /** Base seed; runs get seeds derived from it. Null means fresh randomness every batch. */
    Long seed;

    public static SimulationConfig defaults() {
        return SimulationConfig.builder().build();
    }

    public SimulationConfig validate() {
        if (numDecks < 1) throw new ConfigurationException("num_decks must be at least 1, got " + numDecks);
        if (minBet <= 0) throw new ConfigurationException("min_bet must be positive, got " + minBet);
        if (playerBalance <= 0) throw new ConfigurationException("player_balance must be positive, got " + playerBalance);
        if (minBet > playerBalance) {
            throw new ConfigurationException("min_bet " + minBet + " exceeds the player balance " + playerBalance);
        }
        if (tableBalance <= 0) throw new ConfigurationException("table_balance must be positive, got " + tableBalance);
        if (numSimulationsPerStrategy < 1) {
            throw new ConfigurationException("num_simulations must be at least 1, got " + numSimulationsPerStrategy);
        }
        if (maxHands < 1) throw new ConfigurationException("max_hands must be at least 1, got " + maxHands);
        if (betMargin < 0) throw new ConfigurationException("bet_margin must not be negative, got " + betMargin);
        if (!(penetration > 0 && penetration <= 1)) {
            throw new ConfigurationException("penetration must be in (0, 1], got " + penetration);
        }
        if (maxSplitHands < 1) throw new ConfigurationException("max_split_hands must be at least 1, got " + maxSplitHands);
        if (workerThreads < 0) throw new ConfigurationException("worker_threads must not be negative, got " + workerThreads);
        return this;
    }

    public TableRules tableRules() {
        return TableRules.builder()
                .tableBalance(tableBalance)
                .minBet(minBet)
                .betMargin(betMargin)
                .numDecks(numDecks)
                .penetration(penetration)
                .allowSurrender(allowSurrender)
                .allowInsurance(allowInsurance)
                .dealerHitsSoft17(dealerHitsSoft17)
                .doubleAfterSplit(doubleAfterSplit)
                .maxSplitHands(maxSplitHands)
                .build();
    }

    public int effectiveWorkerThreads() {
        return workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
    }
}
