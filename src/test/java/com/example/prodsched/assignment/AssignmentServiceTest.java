package com.example.prodsched.assignment;

import com.example.prodsched.config.AssignmentSettings;
import com.example.prodsched.scenario.Scenario;
import com.example.prodsched.scenario.ScenarioCatalog;
import com.example.prodsched.schedule.ScenarioStateStore;
import com.example.prodsched.schedule.ScheduleAggregator;
import com.example.prodsched.schedule.WorkerSummary;
import com.example.prodsched.task.Task;
import com.example.prodsched.task.TaskClassifier;
import com.example.prodsched.workforce.CapacityExpander;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AssignmentServiceTest {

    private final ScenarioCatalog catalog = new ScenarioCatalog();
    private final ScenarioStateStore stateStore = new ScenarioStateStore();

    private static LocalDateTime at(int hour, int minute) {
        return LocalDateTime.of(2025, 8, 25, hour, minute);
    }

    private AssignmentService service(boolean clearRecordOnConflict) {
        AssignmentSettings settings = new AssignmentSettings("CC_", "QI_", "LP_", "RW_",
                List.of("Customer", "Customer Inspection"), "Quality Inspection", "Late Part", "Rework",
                24, TaskOrdering.PRIORITY_THEN_START, clearRecordOnConflict);
        TaskClassifier classifier = new TaskClassifier(settings);
        return new AssignmentService(catalog, stateStore, new CapacityExpander(), classifier,
                new AssignmentMatcher(classifier), new ScheduleAggregator(), settings);
    }

    private void register(String id, int mechanics) {
        Map<String, Integer> capacities = new LinkedHashMap<>();
        capacities.put("Mechanic Team 1", mechanics);
        capacities.put("Quality Team 1", 1);
        List<Task> tasks = List.of(
                Task.of("T2", "Mechanic Team 1", null, 2, at(9, 30), at(10, 30), 2),
                Task.of("T1", "Mechanic Team 1", null, 1, at(9, 0), at(10, 0), 1),
                Task.of("QI_1", "Quality Team 1", null, 1, at(10, 30), at(11, 0), 3));
        catalog.register(new Scenario(id, id, tasks, capacities));
    }

    @Test
    void autoAssign_ordersByPriorityAndSummarizesTeamsAndWorkers() {
        register("s1", 2);

        AutoAssignSummary summary = service(false).autoAssign("s1", AutoAssignRequest.all());

        assertThat(summary.results()).extracting(TaskAssignmentResult::taskId).containsExactly("T1", "T2", "QI_1");
        assertThat(summary.fullCount()).isEqualTo(2);
        assertThat(summary.partialCount()).isEqualTo(1);
        assertThat(summary.roles()).containsEntry("Mechanic", 2).containsEntry("Quality Inspector", 1);

        assertThat(summary.teamStatistics()).extracting(TeamStatistics::team)
                .containsExactly("Mechanic Team 1", "Quality Team 1");
        TeamStatistics mechanics = summary.teamStatistics().get(0);
        assertThat(mechanics.capacity()).isEqualTo(2);
        assertThat(mechanics.tasksAssigned()).isEqualTo(2);
        assertThat(mechanics.partial()).isEqualTo(1);
        assertThat(mechanics.successRate()).isEqualTo(50.0);

        assertThat(summary.workerSummaries()).extracting(WorkerSummary::workerId)
                .containsExactly("Mechanic Team 1_1", "Mechanic Team 1_2", "Quality Team 1_1");
        assertThat(stateStore.getOrCreate("s1").getWorkerSchedules()).hasSize(3);
    }

    @Test
    void autoAssign_keepsPriorRecordOnConflictByDefault() {
        register("s2", 2);
        AssignmentService service = service(false);
        service.autoAssign("s2", null);

        register("s2", 0);
        AutoAssignSummary rerun = service.autoAssign("s2", null);

        assertThat(rerun.conflictCount()).isEqualTo(2);
        assertThat(service.getRecords("s2")).containsOnlyKeys("T2", "T1", "QI_1");
        assertThat(service.getRecords("s2").get("T1").workerIds()).containsExactly("Mechanic Team 1_1");
    }

    @Test
    void autoAssign_clearsConflictedRecordsWhenConfigured() {
        register("s3", 2);
        AssignmentService service = service(true);
        service.autoAssign("s3", null);

        register("s3", 0);
        service.autoAssign("s3", null);

        assertThat(service.getRecords("s3")).containsOnlyKeys("QI_1");
        assertThat(stateStore.getOrCreate("s3").getWorkerSchedules()).containsOnlyKeys("Quality Team 1_1");
    }

    @Test
    void autoAssign_asGivenOrderingChangesTheOutcome() {
        register("s4", 2);

        AutoAssignSummary summary = service(false)
                .autoAssign("s4", new AutoAssignRequest(null, null, TaskOrdering.AS_GIVEN, null, null));

        assertThat(summary.results()).extracting(TaskAssignmentResult::taskId).containsExactly("T2", "T1", "QI_1");
        assertThat(summary.results().get(0).outcome()).isEqualTo(AssignmentOutcome.FULL);
        assertThat(summary.results().get(1).outcome()).isEqualTo(AssignmentOutcome.CONFLICT);
    }

    @Test
    void autoAssign_reportsNullTaskRowsInsteadOfFailing() {
        List<Task> tasks = new ArrayList<>();
        tasks.add(Task.of("T1", "Mechanic Team 1", null, 1, at(9, 0), at(10, 0), 1));
        tasks.add(null);
        catalog.register(new Scenario("nulls", "nulls", tasks, Map.of("Mechanic Team 1", 1)));

        for (TaskOrdering ordering : TaskOrdering.values()) {
            AutoAssignSummary summary = service(false)
                    .autoAssign("nulls", new AutoAssignRequest(null, null, ordering, null, null));

            assertThat(summary.fullCount()).isEqualTo(1);
            assertThat(summary.skipped()).hasSize(1);
            assertThat(summary.results()).extracting(TaskAssignmentResult::outcome)
                    .containsExactly(AssignmentOutcome.FULL, AssignmentOutcome.SKIPPED);
            service(false).clearScenarioAssignments("nulls");
        }
    }

    @Test
    void autoAssign_duplicateIdWithMalformedFirstCopyIsSkippedEverywhere() {
        List<Task> tasks = List.of(
                Task.of("T1", null, null, 1, at(9, 0), at(10, 0), 1),
                Task.of("T1", "Mechanic Team 1", null, 1, at(9, 0), at(10, 0), 1),
                Task.of("T2", "Mechanic Team 1", null, 1, at(11, 0), at(12, 0), 2));
        catalog.register(new Scenario("dups", "dups", tasks, Map.of("Mechanic Team 1", 1)));
        AssignmentService service = service(false);

        AutoAssignSummary summary = service.autoAssign("dups", null);

        assertThat(summary.fullCount()).isEqualTo(1);
        assertThat(summary.skipped()).hasSize(2);
        assertThat(summary.teamStatistics()).singleElement()
                .satisfies(stats -> assertThat(stats.tasksAssigned()).isEqualTo(1));
        assertThat(service.getRecords("dups")).containsOnlyKeys("T2");
        assertThat(stateStore.getOrCreate("dups").getWorkerSchedules()).containsOnlyKeys("Mechanic Team 1_1");
    }

    @Test
    void scenariosDoNotShareAssignments() {
        register("a", 2);
        register("b", 2);
        AssignmentService service = service(false);

        service.autoAssign("a", null);

        assertThat(service.getRecords("a")).hasSize(3);
        assertThat(service.getRecords("b")).isEmpty();
        assertThat(service.progress("b").unassigned()).isEqualTo(3);
    }
}
