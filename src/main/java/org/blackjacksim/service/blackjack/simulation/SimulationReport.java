package org.blackjacksim.service.blackjack.simulation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.blackjacksim.model.blackjack.AggregateStats;
import org.blackjacksim.model.blackjack.SimulationResult;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class SimulationReport {
    /** Keyed by strategy name, in the order the strategies were requested. */
    Map<String, AggregateStats> stats;
    /** Per-run results; empty when per-simulation output is off. */
    @Singular List<SimulationResult> results;
    int requestedRuns;
    int aggregatedRuns;
    @Singular List<String> failures;
    long elapsedMillis;

    public int failureCount() {
        return failures.size();
    }
}
