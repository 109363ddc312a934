package com.example.prodsched.schedule;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-scenario assignment state for the lifetime of the process. Entries are
 * created on first access and only emptied by an explicit clear.
 */
@Component
public class ScenarioStateStore {

    private final Map<String, ScenarioState> states = new ConcurrentHashMap<>();

    public ScenarioState getOrCreate(String scenarioId) {
        return states.computeIfAbsent(scenarioId, ScenarioState::new);
    }

    /** Empties one scenario's records and schedules; other scenarios are untouched. */
    public void clearScenarioAssignments(String scenarioId) {
        ScenarioState state = states.get(scenarioId);
        if (state != null) {
            state.clear();
        }
    }
}
