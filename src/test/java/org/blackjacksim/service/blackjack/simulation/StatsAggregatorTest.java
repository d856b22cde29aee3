package org.blackjacksim.service.blackjack.simulation;

import org.blackjacksim.model.blackjack.AggregateStats;
import org.blackjacksim.model.blackjack.SimulationResult;
import org.blackjacksim.model.blackjack.TerminalReason;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class StatsAggregatorTest {

    private final StatsAggregator aggregator = new StatsAggregator();

    private static SimulationResult result(String strategy, int run, double end, int hands,
                                           int w, int p, int l, TerminalReason reason) {
        return SimulationResult.builder()
                .strategy(strategy).runIndex(run).seed(run)
                .startingBalance(100).endingBalance(end)
                .handsPlayed(hands).terminalReason(reason)
                .wins(w).pushes(p).losses(l).playerBlackjacks(w / 5)
                .totalWagered(hands * 5.0)
                .build();
    }

    @Test
    void aggregate_computesTotalsAndRates() {
        List<SimulationResult> results = List.of(
                result("Hi-Lo", 0, 150, 10, 6, 1, 3, TerminalReason.HAND_LIMIT_REACHED),
                result("Hi-Lo", 1, 0, 30, 9, 3, 18, TerminalReason.BANKRUPT));

        AggregateStats s = aggregator.aggregate(results, List.of("Hi-Lo"), 2).get("Hi-Lo");

        assertThat(s.getAggregatedRuns()).isEqualTo(2);
        assertThat(s.getTotalNetProfit()).isEqualTo(-50.0);
        assertThat(s.getMeanNetProfit()).isEqualTo(-25.0);
        assertThat(s.getTotalHands()).isEqualTo(40);
        assertThat(s.getAverageHandsSurvived()).isEqualTo(20.0);
        assertThat(s.getWinRate()).isEqualTo(15.0 / 40);
        assertThat(s.getPushRate()).isEqualTo(4.0 / 40);
        assertThat(s.getLossRate()).isEqualTo(21.0 / 40);
        assertThat(s.getAverageWinningsPerHand()).isEqualTo(-50.0 / 40);
        assertThat(s.getProfitPerUnitBet()).isEqualTo(-50.0 / 200);
        assertThat(s.getEarlyEndings()).isEqualTo(1);
    }

    @Test
    void aggregate_arrivalOrderDoesNotChangeStats() {
        Random rnd = new Random(2024);
        List<SimulationResult> results = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            String strategy = i % 2 == 0 ? "A" : "B";
            results.add(result(strategy, i, 100 + rnd.nextGaussian() * 37.3, 1 + rnd.nextInt(300),
                    rnd.nextInt(100), rnd.nextInt(20), rnd.nextInt(100),
                    rnd.nextBoolean() ? TerminalReason.BANKRUPT : TerminalReason.HAND_LIMIT_REACHED));
        }
        Map<String, AggregateStats> reference = aggregator.aggregate(results, List.of("A", "B"), 100);

        for (int round = 0; round < 10; round++) {
            List<SimulationResult> shuffled = new ArrayList<>(results);
            Collections.shuffle(shuffled, rnd);
            assertThat(aggregator.aggregate(shuffled, List.of("A", "B"), 100)).isEqualTo(reference);
        }
    }

    @Test
    void aggregate_strategyWithoutRunsGetsEmptyStats() {
        Map<String, AggregateStats> out = aggregator.aggregate(List.of(), List.of("Hi-Lo", "KO"), 5);

        assertThat(out).containsOnlyKeys("Hi-Lo", "KO");
        assertThat(out.get("KO").getAggregatedRuns()).isZero();
        assertThat(out.get("KO").getRequestedRuns()).isEqualTo(5);
        assertThat(out.get("KO").getMeanNetProfit()).isZero();
    }

    @Test
    void aggregate_keepsRequestedStrategyOrder() {
        List<SimulationResult> results = List.of(
                result("Zen Count", 0, 110, 5, 3, 0, 2, TerminalReason.HAND_LIMIT_REACHED),
                result("Hi-Lo", 0, 90, 5, 2, 0, 3, TerminalReason.HAND_LIMIT_REACHED));

        assertThat(aggregator.aggregate(results, List.of("Zen Count", "Hi-Lo"), 1).keySet())
                .containsExactly("Zen Count", "Hi-Lo");
    }
}
