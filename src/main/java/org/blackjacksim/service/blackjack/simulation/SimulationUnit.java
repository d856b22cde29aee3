package org.blackjacksim.service.blackjack.simulation;

import org.blackjacksim.service.blackjack.strategy.Strategy;

/**
 * One (strategy, run) pair scheduled on the worker pool.
 */
public record SimulationUnit(Strategy strategy, int strategyIndex, int runIndex, long seed) {

    public String label() {
        return strategy.name() + "#" + runIndex;
    }
}
