package org.blackjacksim.dto.blackjack;

import jakarta.validation.constraints.*;
import lombok.Data;
import org.blackjacksim.config.SimulationConfig;

import java.util.List;

/**
 * Body of {@code POST /api/simulations}. Every field is optional; missing ones fall back to the server defaults.
 */
@Data
public class SimulationRequest {
    @Positive
    private Double tableBalance;
    @Positive
    private Double playerBalance;
    @Min(1) @Max(16)
    private Integer numDecks;
    @Min(1) @Max(100_000)
    private Integer numSimulations;
    @Min(1) @Max(1_000_000)
    private Integer maxHands;
    @Positive
    private Double minBet;
    @PositiveOrZero
    private Double betMargin;
    private Integer betThreshold;
    private Boolean allowSurrender;
    private Boolean allowInsurance;
    private Boolean dealerHitsSoft17;
    private Boolean showPerSimulationOutput;
    private List<String> strategies;
    @DecimalMin(value = "0.0", inclusive = false) @DecimalMax("1.0")
    private Double penetration;
    @Min(1)
    private Integer maxSplitHands;
    private Boolean doubleAfterSplit;
    @PositiveOrZero
    private Integer workerThreads;
    private Long seed;

    public SimulationConfig applyTo(SimulationConfig defaults) {
        SimulationConfig.SimulationConfigBuilder b = defaults.toBuilder();
        if (tableBalance != null) b.tableBalance(tableBalance);
        if (playerBalance != null) b.playerBalance(playerBalance);
        if (numDecks != null) b.numDecks(numDecks);
        if (numSimulations != null) b.numSimulationsPerStrategy(numSimulations);
        if (maxHands != null) b.maxHands(maxHands);
        if (minBet != null) b.minBet(minBet);
        if (betMargin != null) b.betMargin(betMargin);
        if (betThreshold != null) b.betThreshold(betThreshold);
        if (allowSurrender != null) b.allowSurrender(allowSurrender);
        if (allowInsurance != null) b.allowInsurance(allowInsurance);
        if (dealerHitsSoft17 != null) b.dealerHitsSoft17(dealerHitsSoft17);
        if (showPerSimulationOutput != null) b.showPerSimulationOutput(showPerSimulationOutput);
        if (strategies != null) b.clearStrategies().strategies(strategies);
        if (penetration != null) b.penetration(penetration);
        if (maxSplitHands != null) b.maxSplitHands(maxSplitHands);
        if (doubleAfterSplit != null) b.doubleAfterSplit(doubleAfterSplit);
        if (workerThreads != null) b.workerThreads(workerThreads);
        if (seed != null) b.seed(seed);
        // the report goes back in the response, never to a server-side file
        b.outputFile(null);
        return b.build();
    }
}
