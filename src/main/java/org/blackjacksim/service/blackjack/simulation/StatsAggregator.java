package org.blackjacksim.service.blackjack.simulation;

import org.blackjacksim.model.blackjack.AggregateStats;
import org.blackjacksim.model.blackjack.SimulationResult;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Folds per-run results into one {@link AggregateStats} per strategy.
 * Results are sorted by run index before summing, so the output does not depend on arrival order.
 */
@Component
public class StatsAggregator {
    private static final Comparator<SimulationResult> RUN_ORDER =
            Comparator.comparingInt(SimulationResult::getRunIndex).thenComparingLong(SimulationResult::getSeed);

    /**
     * @param strategyOrder strategies in report order; a strategy with no surviving run still gets an entry
     * @param requestedRuns runs scheduled per strategy
     */
    public Map<String, AggregateStats> aggregate(Collection<SimulationResult> results,
                                                 List<String> strategyOrder,
                                                 int requestedRuns) {
        Map<String, List<SimulationResult>> byStrategy = results.stream()
                .collect(Collectors.groupingBy(SimulationResult::getStrategy));

        Map<String, AggregateStats> out = new LinkedHashMap<>();
        for (String name : strategyOrder) {
            out.put(name, summarize(name, byStrategy.getOrDefault(name, List.of()), requestedRuns));
        }
        // results for strategies the caller did not list, in name order
        new TreeSet<>(byStrategy.keySet()).stream()
                .filter(name -> !out.containsKey(name))
                .forEach(name -> out.put(name, summarize(name, byStrategy.get(name), requestedRuns)));
        return out;
    }

    AggregateStats summarize(String strategy, List<SimulationResult> runs, int requestedRuns) {
        List<SimulationResult> sorted = new ArrayList<>(runs);
        sorted.sort(RUN_ORDER);

        double net = 0, wagered = 0;
        long hands = 0, wins = 0, pushes = 0, losses = 0, blackjacks = 0;
        int early = 0;
        for (SimulationResult r : sorted) {
            net += r.netProfit();
            wagered += r.getTotalWagered();
            hands += r.getHandsPlayed();
            wins += r.getWins();
            pushes += r.getPushes();
            losses += r.getLosses();
            blackjacks += r.getPlayerBlackjacks();
            if (r.endedEarly()) early++;
        }
        int n = sorted.size();
        long settled = wins + pushes + losses;

        return AggregateStats.builder()
                .strategy(strategy)
                .requestedRuns(requestedRuns)
                .aggregatedRuns(n)
                .totalNetProfit(net)
                .meanNetProfit(ratio(net, n))
                .profitPerUnitBet(ratio(net, wagered))
                .winRate(ratio(wins, settled))
                .pushRate(ratio(pushes, settled))
                .lossRate(ratio(losses, settled))
                .averageHandsSurvived(ratio(hands, n))
                .averageWinningsPerHand(ratio(net, hands))
                .totalHands(hands)
                .totalWins(wins)
                .totalPushes(pushes)
                .totalLosses(losses)
                .playerBlackjacks(blackjacks)
                .earlyEndings(early)
                .build();
    }

    private static double ratio(double num, double den) {
        return den == 0 ? 0 : num / den;
    }
}
