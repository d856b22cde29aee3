package org.blackjacksim.controller;

import jakarta.validation.Valid;
import org.blackjacksim.config.SimulationConfig;
import org.blackjacksim.config.SimulationProperties;
import org.blackjacksim.dto.blackjack.SimulationRequest;
import org.blackjacksim.service.blackjack.simulation.BlackjackSimulationService;
import org.blackjacksim.service.blackjack.simulation.SimulationReport;
import org.blackjacksim.service.blackjack.strategy.StrategyCatalog;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/simulations")
public class SimulationController {

    @Autowired private BlackjackSimulationService simulations;
    @Autowired private StrategyCatalog catalog;
    @Autowired private SimulationProperties properties;

    // ==================== RUN A BATCH ====================
    @PostMapping
    public ResponseEntity<SimulationReport> run(@Valid @RequestBody(required = false) SimulationRequest req) {
        SimulationConfig config = properties.toConfig();
        if (req != null) config = req.applyTo(config);
        return ResponseEntity.ok(simulations.run(config));
    }

    @GetMapping("/strategies")
    public ResponseEntity<List<String>> strategies() {
        return ResponseEntity.ok(catalog.names());
    }

    @GetMapping("/defaults")
    public ResponseEntity<SimulationConfig> defaults() {
        return ResponseEntity.ok(properties.toConfig());
    }
}
