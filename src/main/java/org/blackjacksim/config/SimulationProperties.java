package org.blackjacksim.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Defaults of the simulator, bound from {@code simulation.*}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "simulation")
public class SimulationProperties {

    /** House bankroll; empty means unlimited. */
    private Double tableBalance;

    private double playerBalance = 500;

    private int numDecks = 6;

    private int numSimulations = 100;

    private int maxHands = 200;

    private double minBet = 5;

    private double betMargin = 2.0;

    private int betThreshold = 1;

    /** Surrender is opt-in. */
    private boolean allowSurrender = false;

    private boolean allowInsurance = false;

    private boolean dealerHitsSoft17 = false;

    private boolean showPerSimulationOutput = true;

    /** Strategy names to run; empty runs every built-in strategy. */
    private List<String> strategies = new ArrayList<>();

    /** Report file; empty writes to standard output. */
    private String outputFile;

    private double penetration = 0.8;

    private int maxSplitHands = 4;

    private boolean doubleAfterSplit = true;

    /** Worker pool size; 0 uses the number of available processors. */
    private int workerThreads = 0;

    private Long seed;

    /** Runs one batch with these settings when the application starts. */
    private boolean runOnStartup = false;

    public SimulationConfig toConfig() {
        return SimulationConfig.builder()
                .tableBalance(tableBalance == null ? Double.MAX_VALUE : tableBalance)
                .playerBalance(playerBalance)
                .numDecks(numDecks)
                .numSimulationsPerStrategy(numSimulations)
                .maxHands(maxHands)
                .minBet(minBet)
                .betMargin(betMargin)
                .betThreshold(betThreshold)
                .allowSurrender(allowSurrender)
                .allowInsurance(allowInsurance)
                .dealerHitsSoft17(dealerHitsSoft17)
                .showPerSimulationOutput(showPerSimulationOutput)
                .strategies(strategies == null ? List.of() : strategies)
                .outputFile(outputFile == null || outputFile.isBlank() ? null : outputFile)
                .penetration(penetration)
                .maxSplitHands(maxSplitHands)
                .doubleAfterSplit(doubleAfterSplit)
                .workerThreads(workerThreads)
                .seed(seed)
                .build();
    }
}
