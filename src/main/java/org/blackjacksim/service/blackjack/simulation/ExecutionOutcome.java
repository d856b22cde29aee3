package org.blackjacksim.service.blackjack.simulation;

import org.blackjacksim.model.blackjack.SimulationResult;

import java.util.List;

/**
 * Everything the worker pool produced for one batch, in arrival order.
 */
public record ExecutionOutcome(List<SimulationResult> results, List<UnitOutcome> failures) {

    public int failureCount() {
        return failures.size();
    }
}
