package com.example.prodsched.scenario;

import com.example.prodsched.exception.BusinessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class ScenarioCatalog {

    private static final Logger logger = LoggerFactory.getLogger(ScenarioCatalog.class);

    private final Map<String, Scenario> scenarios = new ConcurrentHashMap<>();

    public void register(Scenario scenario) {
        if (scenario == null || scenario.id() == null || scenario.id().isBlank()) {
            throw new IllegalArgumentException("scenario id is required");
        }
        scenarios.put(scenario.id(), scenario);
        logger.info("Registered scenario {} with {} tasks and {} capacity entries",
                scenario.id(), scenario.tasks().size(), scenario.teamCapacities().size());
    }

    public Optional<Scenario> find(String scenarioId) {
        return Optional.ofNullable(scenarios.get(scenarioId));
    }

    public Scenario require(String scenarioId) {
        return find(scenarioId).orElseThrow(() -> BusinessException.scenarioNotFound(scenarioId));
    }

    public List<Scenario> list() {
        return scenarios.values().stream()
                .sorted(Comparator.comparing(Scenario::id))
                .toList();
    }

    public boolean isEmpty() {
        return scenarios.isEmpty();
    }
}
