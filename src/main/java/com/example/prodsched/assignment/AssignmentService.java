package com.example.prodsched.assignment;

import com.example.prodsched.config.AssignmentSettings;
import com.example.prodsched.exception.BusinessException;
import com.example.prodsched.scenario.Scenario;
import com.example.prodsched.scenario.ScenarioCatalog;
import com.example.prodsched.schedule.ScenarioState;
import com.example.prodsched.schedule.ScenarioStateStore;
import com.example.prodsched.schedule.ScheduleAggregator;
import com.example.prodsched.schedule.WorkerSummary;
import com.example.prodsched.task.ClassifiedTask;
import com.example.prodsched.task.Task;
import com.example.prodsched.task.TaskClassifier;
import com.example.prodsched.workforce.CapacityExpander;
import com.example.prodsched.workforce.SkillFilter;
import com.example.prodsched.workforce.TeamFilter;
import com.example.prodsched.workforce.TeamSkillLabel;
import com.example.prodsched.workforce.Worker;
import com.example.prodsched.workforce.WorkerPool;
import com.example.prodsched.workforce.WorkerRole;
import com.example.prodsched.workforce.TaskCommitment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs auto-assignment for a scenario under a filter context and commits the
 * result to that scenario's state. Runs against one scenario are serialized on
 * its state; a run that fails is never committed.
 */
@Service
public class AssignmentService {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentService.class);

    private final ScenarioCatalog catalog;
    private final ScenarioStateStore stateStore;
    private final CapacityExpander capacityExpander;
    private final TaskClassifier classifier;
    private final AssignmentMatcher matcher;
    private final ScheduleAggregator aggregator;
    private final AssignmentSettings settings;

    public AssignmentService(ScenarioCatalog catalog,
                             ScenarioStateStore stateStore,
                             CapacityExpander capacityExpander,
                             TaskClassifier classifier,
                             AssignmentMatcher matcher,
                             ScheduleAggregator aggregator,
                             AssignmentSettings settings) {
        this.catalog = catalog;
        this.stateStore = stateStore;
        this.capacityExpander = capacityExpander;
        this.classifier = classifier;
        this.matcher = matcher;
        this.aggregator = aggregator;
        this.settings = settings;
    }

    public AutoAssignSummary autoAssign(String scenarioId, AutoAssignRequest request) {
        Scenario scenario = catalog.require(scenarioId);
        AutoAssignRequest req = request == null ? AutoAssignRequest.all() : request;
        TeamFilter teams = TeamFilter.parse(req.team());
        SkillFilter skills = SkillFilter.parse(req.skill());
        TaskOrdering ordering = req.ordering() == null ? settings.getDefaultOrdering() : req.ordering();

        List<Task> ordered = ordering.apply(selectTasks(scenario, teams, skills, req.shift(), req.product()));
        WorkerPool pool = capacityExpander.buildWorkerPool(scenario.teamCapacities(), teams, skills);
        AssignmentRunResult run = matcher.runAssignment(ordered, pool);

        ScenarioState state = stateStore.getOrCreate(scenarioId);
        synchronized (state) {
            state.putRecords(run.records().values());
            if (settings.isClearRecordOnConflict()) {
                run.conflictTaskIds().forEach(state::removeRecord);
            }
            aggregator.rebuildWorkerSchedules(state, scenario.taskTable());
        }
        logger.info("Scenario {} auto-assign (team={}, skill={}, ordering={}): {} tasks, {} full, {} partial, {} conflicts",
                scenarioId, teams, skills, ordering, ordered.size(), run.fullCount(), run.partialCount(),
                run.conflictCount());

        Map<String, Integer> roles = new LinkedHashMap<>();
        run.roleBreakdown().forEach((role, count) -> roles.put(role.getLabel(), count));
        return new AutoAssignSummary(scenarioId, teams.toString(), skills.toString(), ordering, ordered.size(),
                run.fullCount(), run.partialCount(), run.conflictCount(), run.totalWorkers(), roles,
                run.results(), run.skipped(), teamStatistics(scenario, run), workerSummaries(pool, scenario));
    }

    public Map<String, AssignmentRecord> getRecords(String scenarioId) {
        catalog.require(scenarioId);
        return stateStore.getOrCreate(scenarioId).getRecords();
    }

    /**
     * Replaces the worker slots of one task, as edited by hand on the dashboard.
     * Blank slots are kept; a record with no filled slot is removed.
     */
    public AssignmentRecord updateAssignment(String scenarioId, String taskId, List<String> workerIds) {
        Scenario scenario = catalog.require(scenarioId);
        Task task = scenario.taskTable().get(taskId);
        if (task == null) {
            throw BusinessException.taskNotFound(scenarioId, taskId);
        }
        Objects.requireNonNull(workerIds, "workerIds");
        Optional<String> invalid = classifier.validate(task);
        if (invalid.isPresent()) {
            throw new IllegalArgumentException("Task " + taskId + " cannot be assigned: " + invalid.get());
        }
        ClassifiedTask classified = classifier.classify(task);
        if (workerIds.size() > classified.requiredWorkers()) {
            throw new IllegalArgumentException("Task " + taskId + " takes at most " + classified.requiredWorkers()
                    + " workers but " + workerIds.size() + " were given");
        }
        AssignmentRecord record = new AssignmentRecord(taskId, workerIds, classified.team(),
                classified.teamSkillKey(), classified.skill(), classified.requiredWorkers(), classified.customerTask());

        ScenarioState state = stateStore.getOrCreate(scenarioId);
        synchronized (state) {
            if (record.filledCount() == 0) {
                state.removeRecord(taskId);
            } else {
                state.putRecord(record);
            }
            aggregator.rebuildWorkerSchedules(state, scenario.taskTable());
        }
        return record;
    }

    public AssignmentProgress progress(String scenarioId) {
        Scenario scenario = catalog.require(scenarioId);
        Map<String, AssignmentRecord> records = stateStore.getOrCreate(scenarioId).getRecords();
        int total = 0, complete = 0, partial = 0, unassigned = 0;
        for (String taskId : scenario.taskTable().keySet()) {
            total++;
            AssignmentRecord record = records.get(taskId);
            if (record == null || record.filledCount() == 0) {
                unassigned++;
            } else if (record.isPartial()) {
                partial++;
            } else {
                complete++;
            }
        }
        double percent = total > 0 ? complete * 100.0 / total : 0.0;
        return new AssignmentProgress(total, complete, partial, unassigned, percent);
    }

    public void clearScenarioAssignments(String scenarioId) {
        catalog.require(scenarioId);
        stateStore.clearScenarioAssignments(scenarioId);
        logger.info("Cleared assignments of scenario {}", scenarioId);
    }

    private List<Task> selectTasks(Scenario scenario, TeamFilter teams, SkillFilter skills, String shift, String product) {
        List<Task> selected = new ArrayList<>();
        for (Task task : scenario.tasks()) {
            if (classifier.validate(task).isPresent()) {
                // malformed rows stay in so the run reports them
                selected.add(task);
                continue;
            }
            if (shift != null && !shift.isBlank() && !"all".equalsIgnoreCase(shift) && !shift.equals(task.shift())) {
                continue;
            }
            if (product != null && !product.isBlank() && !"all".equalsIgnoreCase(product)
                    && !product.equals(task.product())) {
                continue;
            }
            ClassifiedTask classified = classifier.classify(task);
            if (!teams.matchesTask(classified.team(), classified.effectiveRole())) {
                continue;
            }
            if (!skills.isAll() && classified.hasSkill() && !skills.matchesSkill(classified.skill())) {
                continue;
            }
            selected.add(task);
        }
        return selected;
    }

    private List<TeamStatistics> teamStatistics(Scenario scenario, AssignmentRunResult run) {
        Map<String, Integer> capacityByTeam = new LinkedHashMap<>();
        scenario.teamCapacities().forEach((label, capacity) -> {
            if (label != null && !label.isBlank()) {
                capacityByTeam.merge(TeamSkillLabel.parse(label).baseTeam(), Math.max(0, capacity == null ? 0 : capacity),
                        Integer::sum);
            }
        });

        Map<String, int[]> counts = new LinkedHashMap<>();
        for (TaskAssignmentResult result : run.results()) {
            if (result.outcome() == AssignmentOutcome.SKIPPED) {
                continue;
            }
            int[] c = counts.computeIfAbsent(result.team(), k -> new int[3]);
            switch (result.outcome()) {
                case FULL -> c[0]++;
                case PARTIAL -> { c[0]++; c[1]++; }
                case CONFLICT -> c[2]++;
                default -> { }
            }
        }

        List<TeamStatistics> stats = new ArrayList<>();
        for (Map.Entry<String, int[]> e : counts.entrySet()) {
            int[] c = e.getValue();
            int attempted = c[0] + c[2];
            double successRate = attempted == 0 ? 0.0 : (c[0] - c[1]) * 100.0 / attempted;
            stats.add(new TeamStatistics(e.getKey(), capacityByTeam.getOrDefault(e.getKey(), 0), c[0], c[1], c[2],
                    successRate));
        }
        stats.sort(Comparator.comparing(TeamStatistics::team));
        return stats;
    }

    // busiest workers first
    private List<WorkerSummary> workerSummaries(WorkerPool pool, Scenario scenario) {
        Map<String, Task> table = scenario.taskTable();
        List<WorkerSummary> summaries = new ArrayList<>();
        for (Worker worker : pool.workers()) {
            List<TaskCommitment> commitments = worker.getAssignedTasks();
            if (commitments.isEmpty()) {
                continue;
            }
            int minutes = 0;
            for (TaskCommitment c : commitments) {
                Task task = table.get(c.taskId());
                minutes += task != null ? task.effectiveDurationMinutes()
                        : (int) Duration.between(c.startTime(), c.endTime()).toMinutes();
            }
            WorkerRole role = worker.getRole();
            summaries.add(new WorkerSummary(worker.getId(), worker.getDisplayName(), worker.getBaseTeam(),
                    worker.getSkill(), role, commitments.size(), minutes / 60.0, worker.getBusyUntil()));
        }
        summaries.sort(Comparator.comparingDouble(WorkerSummary::utilizationHours).reversed()
                .thenComparing(WorkerSummary::workerId));
        return summaries;
    }
}
