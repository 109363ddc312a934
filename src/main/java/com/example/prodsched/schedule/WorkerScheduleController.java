package com.example.prodsched.schedule;

import com.example.prodsched.common.ApiResponse;
import com.example.prodsched.scenario.ScenarioCatalog;
import com.example.prodsched.workforce.SkillFilter;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.Optional;

@RestController
@RequestMapping("/api/scenarios/{scenarioId}")
public class WorkerScheduleController {

    private final ScenarioCatalog catalog;
    private final ScenarioStateStore stateStore;
    private final ScheduleAggregator aggregator;

    public WorkerScheduleController(ScenarioCatalog catalog, ScenarioStateStore stateStore,
                                    ScheduleAggregator aggregator) {
        this.catalog = catalog;
        this.stateStore = stateStore;
        this.aggregator = aggregator;
    }

    @GetMapping("/workers")
    public ResponseEntity<ApiResponse<AggregatedSchedule>> aggregated(
            @PathVariable("scenarioId") String scenarioId,
            @RequestParam(name = "role", required = false, defaultValue = "all") String role) {
        AggregatedSchedule view = aggregator.getAggregatedSchedule(state(scenarioId), RoleFilter.parse(role));
        return ResponseEntity.ok(ApiResponse.success("aggregated schedule", view));
    }

    @GetMapping("/workers/{workerId}")
    public ResponseEntity<ApiResponse<WorkerScheduleView>> worker(
            @PathVariable("scenarioId") String scenarioId,
            @PathVariable("workerId") String workerId,
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        Optional<WorkerScheduleView> view = aggregator.getWorkerScheduleView(state(scenarioId), workerId, date);
        if (view.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiResponse.failure("No assignments for worker " + workerId));
        }
        return ResponseEntity.ok(ApiResponse.success("worker schedule", view.get()));
    }

    @GetMapping("/teams/{team}/schedule")
    public ResponseEntity<ApiResponse<AggregatedSchedule>> team(
            @PathVariable("scenarioId") String scenarioId,
            @PathVariable("team") String team,
            @RequestParam(name = "skill", required = false, defaultValue = "all") String skill) {
        AggregatedSchedule view = aggregator.getTeamSchedule(state(scenarioId), team, SkillFilter.parse(skill));
        return ResponseEntity.ok(ApiResponse.success("team schedule", view));
    }

    private ScenarioState state(String scenarioId) {
        catalog.require(scenarioId);
        return stateStore.getOrCreate(scenarioId);
    }
}
