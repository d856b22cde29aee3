package org.blackjacksim.service.blackjack.strategy;

import org.blackjacksim.config.SimulationConfig;
import org.blackjacksim.exception.ConfigurationException;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * The built-in counting strategies, one per {@link CountingSystem}.
 */
@Component
public class StrategyCatalog {

    public List<String> names() {
        return Arrays.stream(CountingSystem.values()).map(CountingSystem::label).toList();
    }

    public List<Strategy> builtIns(SimulationConfig cfg) {
        BettingPolicy betting = new MarginBettingPolicy(cfg.getBetMargin(), cfg.getBetThreshold());
        List<Strategy> out = new ArrayList<>();
        for (CountingSystem system : CountingSystem.values()) out.add(new CountingStrategy(system, betting));
        return out;
    }

    /**
     * Strategies named in the config, in the order given; all of them when none is named.
     * Names match the label ("Hi-Lo") or the constant ("HI_LO"), ignoring case.
     */
    public List<Strategy> select(SimulationConfig cfg) {
        List<Strategy> all = builtIns(cfg);
        if (cfg.getStrategies().isEmpty()) return all;

        Map<String, Strategy> byKey = new HashMap<>();
        for (Strategy s : all) {
            CountingSystem system = ((CountingStrategy) s).system();
            byKey.put(normalize(system.label()), s);
            byKey.put(normalize(system.name()), s);
        }
        LinkedHashSet<Strategy> selected = new LinkedHashSet<>();
        for (String name : cfg.getStrategies()) {
            Strategy s = byKey.get(normalize(name));
            if (s == null) {
                throw new ConfigurationException("Unknown strategy '" + name + "', known: " + names());
            }
            selected.add(s);
        }
        return new ArrayList<>(selected);
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
