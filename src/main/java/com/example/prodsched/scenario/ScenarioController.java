package com.example.prodsched.scenario;

import com.example.prodsched.common.ApiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/scenarios")
public class ScenarioController {

    private final ScenarioCatalog catalog;

    public ScenarioController(ScenarioCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping("")
    public ResponseEntity<ApiResponse<List<Map<String, Object>>>> listScenarios() {
        List<Map<String, Object>> data = catalog.list().stream()
                .map(this::toSummaryMap)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("scenarios", data));
    }

    @GetMapping("/{scenarioId}")
    public ResponseEntity<ApiResponse<Scenario>> getScenario(@PathVariable("scenarioId") String scenarioId) {
        return ResponseEntity.ok(ApiResponse.success("scenario", catalog.require(scenarioId)));
    }

    @PutMapping("/{scenarioId}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> registerScenario(
            @PathVariable("scenarioId") String scenarioId,
            @RequestBody Scenario scenario) {
        Scenario registered = scenario.withId(scenarioId);
        catalog.register(registered);
        return ResponseEntity.ok(ApiResponse.success("Scenario registered", toSummaryMap(registered)));
    }

    private Map<String, Object> toSummaryMap(Scenario scenario) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", scenario.id());
        m.put("name", scenario.name());
        m.put("taskCount", scenario.tasks().size());
        m.put("teamCount", scenario.teamCapacities().size());
        m.put("totalCapacity", scenario.teamCapacities().values().stream()
                .mapToInt(c -> c == null ? 0 : Math.max(0, c)).sum());
        return m;
    }
}
