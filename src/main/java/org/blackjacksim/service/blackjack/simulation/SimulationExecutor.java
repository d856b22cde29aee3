package org.blackjacksim.service.blackjack.simulation;

import lombok.extern.slf4j.Slf4j;
import org.blackjacksim.config.SimulationConfig;
import org.blackjacksim.exception.ShoeExhaustedException;
import org.blackjacksim.exception.SimulationException;
import org.blackjacksim.model.blackjack.SimulationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs simulation units on a bounded worker pool.
 * <p>
 * Each unit builds its own shoe, tracker and account inside the worker, so nothing mutable crosses threads.
 * Workers post one {@link UnitOutcome} per unit on a shared queue; the calling thread is the only consumer.
 * A unit that throws is retried once with the same seed. An exhausted shoe is never retried.
 */
@Slf4j
@Component
public class SimulationExecutor {
    private static final long SHUTDOWN_GRACE_SECONDS = 5;
    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    public ExecutionOutcome execute(List<SimulationUnit> units, SimulationConfig config) {
        return execute(units, config, config.effectiveWorkerThreads());
    }

    public ExecutionOutcome execute(List<SimulationUnit> units, SimulationConfig config, int threads) {
        if (units.isEmpty()) return new ExecutionOutcome(List.of(), List.of());

        int poolSize = Math.max(1, Math.min(threads, units.size()));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, workerFactory());
        BlockingQueue<UnitOutcome> channel = new LinkedBlockingQueue<>();
        List<Future<?>> futures = new ArrayList<>(units.size());
        log.info("Running {} simulations on {} workers", units.size(), poolSize);

        try {
            for (SimulationUnit unit : units) {
                futures.add(pool.submit(() -> {
                    UnitOutcome outcome = UnitOutcome.failure(unit, "worker terminated abnormally", 0);
                    try {
                        outcome = runWithRetry(unit, config);
                    } finally {
                        channel.add(outcome);
                    }
                }));
            }

            List<SimulationResult> results = new ArrayList<>(units.size());
            List<UnitOutcome> failures = new ArrayList<>();
            for (int received = 0; received < units.size(); received++) {
                UnitOutcome outcome = channel.take();
                if (outcome.succeeded()) {
                    results.add(outcome.result());
                } else {
                    failures.add(outcome);
                }
            }
            if (!failures.isEmpty()) {
                log.warn("{} of {} simulations were excluded from the results", failures.size(), units.size());
            }
            return new ExecutionOutcome(results, failures);
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new SimulationException("Simulation batch interrupted", e);
        } finally {
            shutdown(pool);
        }
    }

    UnitOutcome runWithRetry(SimulationUnit unit, SimulationConfig config) {
        int attempts = 0;
        RuntimeException last = null;
        while (attempts < 2) {
            attempts++;
            try {
                SimulationResult result = new SimulationRunner(unit.strategy(), config, unit.runIndex(), unit.seed()).run();
                return UnitOutcome.success(unit, result, attempts);
            } catch (ShoeExhaustedException e) {
                log.error("[{}] shoe exhausted, run excluded: {}", unit.label(), e.getMessage());
                return UnitOutcome.failure(unit, e.getMessage(), attempts);
            } catch (RuntimeException e) {
                last = e;
                log.warn("[{}] attempt {} failed: {}", unit.label(), attempts, e.toString());
            }
        }
        log.warn("[{}] excluded after {} attempts", unit.label(), attempts);
        return UnitOutcome.failure(unit, String.valueOf(last), attempts);
    }

    private static ThreadFactory workerFactory() {
        int pool = POOL_SEQ.incrementAndGet();
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "sim-" + pool + "-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
