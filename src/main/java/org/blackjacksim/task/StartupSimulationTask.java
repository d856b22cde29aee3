package org.blackjacksim.task;

import lombok.extern.slf4j.Slf4j;
import org.blackjacksim.config.SimulationConfig;
import org.blackjacksim.config.SimulationProperties;
import org.blackjacksim.service.blackjack.report.SimulationReportWriter;
import org.blackjacksim.service.blackjack.simulation.BlackjackSimulationService;
import org.blackjacksim.service.blackjack.simulation.SimulationReport;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

// Batch mode: one run with the configured defaults, report to stdout or simulation.output-file
@Slf4j
@Component
@ConditionalOnProperty(prefix = "simulation", name = "run-on-startup", havingValue = "true")
public class StartupSimulationTask implements CommandLineRunner {
    @Autowired
    private SimulationProperties properties;
    @Autowired
    private BlackjackSimulationService simulations;
    @Autowired
    private SimulationReportWriter writer;

    @Override
    public void run(String... args) {
        SimulationConfig config = properties.toConfig();
        log.info("Startup batch: {} runs per strategy, {} hands max", config.getNumSimulationsPerStrategy(),
                config.getMaxHands());
        SimulationReport report = simulations.run(config);
        writer.write(report, config.getOutputFile());
    }
}
