package org.blackjacksim.service.blackjack.simulation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.blackjacksim.config.SimulationConfig;
import org.blackjacksim.exception.ConfigurationException;
import org.blackjacksim.model.blackjack.AggregateStats;
import org.blackjacksim.model.blackjack.SimulationResult;
import org.blackjacksim.service.blackjack.strategy.Strategy;
import org.blackjacksim.service.blackjack.strategy.StrategyCatalog;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.*;

/**
 * Entry point of a simulation batch: validates the configuration, schedules every (strategy, run) pair
 * and aggregates what comes back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlackjackSimulationService {
    private static final long GOLDEN = 0x9E3779B97F4A7C15L;

    private final StrategyCatalog catalog;
    private final SimulationExecutor executor;
    private final StatsAggregator aggregator;
    private final SecureRandom seeds = new SecureRandom();

    public SimulationReport run(SimulationConfig config) {
        config.validate();
        return run(config, catalog.select(config));
    }

    public SimulationReport run(SimulationConfig config, List<Strategy> strategies) {
        config.validate();
        if (strategies == null || strategies.isEmpty()) {
            throw new ConfigurationException("At least one strategy is required");
        }
        Set<String> names = new HashSet<>();
        for (Strategy s : strategies) {
            if (!names.add(s.name())) throw new ConfigurationException("Duplicate strategy name: " + s.name());
        }

        int runs = config.getNumSimulationsPerStrategy();
        List<SimulationUnit> units = new ArrayList<>(strategies.size() * runs);
        for (int si = 0; si < strategies.size(); si++) {
            for (int run = 0; run < runs; run++) {
                units.add(new SimulationUnit(strategies.get(si), si, run, seedFor(config.getSeed(), si, run)));
            }
        }

        long started = System.currentTimeMillis();
        ExecutionOutcome outcome = executor.execute(units, config);
        List<String> order = strategies.stream().map(Strategy::name).toList();
        Map<String, AggregateStats> stats = aggregator.aggregate(outcome.results(), order, runs);
        long elapsed = System.currentTimeMillis() - started;

        List<SimulationResult> perRun = List.of();
        if (config.isShowPerSimulationOutput()) {
            perRun = new ArrayList<>(outcome.results());
            perRun.sort(Comparator.comparingInt((SimulationResult r) -> order.indexOf(r.getStrategy()))
                    .thenComparingInt(SimulationResult::getRunIndex));
        }

        log.info("Batch done: {} strategies x {} runs, {} aggregated, {} excluded in {} ms",
                strategies.size(), runs, outcome.results().size(), outcome.failureCount(), elapsed);
        return SimulationReport.builder()
                .stats(stats)
                .results(perRun)
                .requestedRuns(units.size())
                .aggregatedRuns(outcome.results().size())
                .failures(outcome.failures().stream().map(f -> f.unit().label() + ": " + f.error()).toList())
                .elapsedMillis(elapsed)
                .build();
    }

    /** Same base seed, strategy and run index always give the same run seed. */
    long seedFor(Long base, int strategyIndex, int runIndex) {
        if (base == null) return seeds.nextLong();
        return new SplittableRandom(base ^ (GOLDEN * (strategyIndex + 1)) ^ ((long) runIndex << 20)).nextLong();
    }
}
