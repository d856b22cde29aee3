package org.blackjacksim.service.blackjack.simulation;

import org.blackjacksim.model.blackjack.SimulationResult;

/**
 * Message a worker posts on the result channel: either a finished result or the reason the unit was dropped.
 */
public record UnitOutcome(SimulationUnit unit, SimulationResult result, String error, int attempts) {

    public static UnitOutcome success(SimulationUnit unit, SimulationResult result, int attempts) {
        return new UnitOutcome(unit, result, null, attempts);
    }

    public static UnitOutcome failure(SimulationUnit unit, String error, int attempts) {
        return new UnitOutcome(unit, null, error, attempts);
    }

    public boolean succeeded() {
        return result != null;
    }
}
