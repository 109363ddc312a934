package com.example.prodsched.schedule;

import com.example.prodsched.assignment.AssignmentRecord;
import com.example.prodsched.task.Task;
import com.example.prodsched.workforce.SkillFilter;
import com.example.prodsched.workforce.TeamSkillLabel;
import com.example.prodsched.workforce.Worker;
import com.example.prodsched.workforce.WorkerRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Projects a scenario's assignment records onto per-worker schedules. The
 * projection is rebuilt from scratch on every call.
 */
@Component
public class ScheduleAggregator {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleAggregator.class);

    private static final Comparator<ScheduledTask> BY_START = Comparator
            .comparing(ScheduledTask::startTime)
            .thenComparing(ScheduledTask::taskId);

    public Map<String, WorkerSchedule> rebuildWorkerSchedules(ScenarioState state, Map<String, Task> taskTable) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(taskTable, "taskTable");

        Map<String, List<ScheduledTask>> tasksByWorker = new TreeMap<>();
        int missing = 0;
        for (AssignmentRecord record : state.getRecords().values()) {
            Task task = taskTable.get(record.taskId());
            if (task == null || task.startTime() == null || task.endTime() == null) {
                missing++;
                continue;
            }
            ScheduledTask entry = new ScheduledTask(record.taskId(), task.startTime(), task.endTime(),
                    task.type(), task.product(), task.effectiveDurationMinutes(), record.team(),
                    record.teamSkill(), record.skill(), record.customerTask());
            for (String workerId : record.assignedWorkerIds()) {
                tasksByWorker.computeIfAbsent(workerId, k -> new ArrayList<>()).add(entry);
            }
        }
        if (missing > 0) {
            logger.warn("Scenario {}: skipped {} assignment records referencing unknown tasks",
                    state.getScenarioId(), missing);
        }

        Map<String, WorkerSchedule> schedules = new LinkedHashMap<>();
        for (Map.Entry<String, List<ScheduledTask>> e : tasksByWorker.entrySet()) {
            List<ScheduledTask> tasks = e.getValue();
            tasks.sort(BY_START);
            schedules.put(e.getKey(), describe(e.getKey(), tasks));
        }
        state.setWorkerSchedules(schedules);
        return state.getWorkerSchedules();
    }

    public Optional<WorkerSchedule> getWorkerSchedule(ScenarioState state, String workerId) {
        return Optional.ofNullable(state.getWorkerSchedules().get(workerId));
    }

    /**
     * Individual schedule, optionally limited to tasks starting on {@code date},
     * with overlaps between consecutive tasks reported.
     */
    public Optional<WorkerScheduleView> getWorkerScheduleView(ScenarioState state, String workerId, LocalDate date) {
        return getWorkerSchedule(state, workerId).map(schedule -> {
            List<ScheduledTask> tasks = schedule.tasks();
            if (date != null) {
                tasks = tasks.stream().filter(t -> t.startTime().toLocalDate().equals(date)).toList();
            }
            WorkerSchedule filtered = new WorkerSchedule(schedule.workerId(), schedule.displayName(),
                    schedule.team(), schedule.teamSkill(), schedule.skill(), schedule.role(),
                    schedule.isQuality(), schedule.isCustomer(), tasks);
            return new WorkerScheduleView(filtered, tasks.size(), findOverlaps(tasks));
        });
    }

    public AggregatedSchedule getAggregatedSchedule(ScenarioState state, RoleFilter roleFilter) {
        RoleFilter filter = roleFilter == null ? RoleFilter.ALL : roleFilter;
        return merge(state, s -> filter.matches(s.role()), null);
    }

    public AggregatedSchedule getTeamSchedule(ScenarioState state, String team, SkillFilter skillFilter) {
        Objects.requireNonNull(team, "team");
        SkillFilter skills = skillFilter == null ? SkillFilter.ALL : skillFilter;
        return merge(state, s -> team.equals(s.team()) && skills.matchesSkill(s.skill()), team);
    }

    static List<ScheduleOverlap> findOverlaps(List<ScheduledTask> sorted) {
        List<ScheduleOverlap> overlaps = new ArrayList<>();
        for (int i = 0; i + 1 < sorted.size(); i++) {
            ScheduledTask current = sorted.get(i);
            ScheduledTask next = sorted.get(i + 1);
            if (current.endTime().isAfter(next.startTime())) {
                long minutes = Duration.between(next.startTime(), current.endTime()).toMinutes();
                overlaps.add(new ScheduleOverlap(current.taskId(), next.taskId(), minutes));
            }
        }
        return overlaps;
    }

    private AggregatedSchedule merge(ScenarioState state, Predicate<WorkerSchedule> include, String teamName) {
        List<AggregatedTask> tasks = new ArrayList<>();
        Map<String, WorkerSummary> workers = new LinkedHashMap<>();
        for (WorkerSchedule schedule : state.getWorkerSchedules().values()) {
            if (!include.test(schedule)) {
                continue;
            }
            workers.put(schedule.workerId(), WorkerSummary.of(schedule));
            for (ScheduledTask task : schedule.tasks()) {
                tasks.add(new AggregatedTask(task, schedule.workerId(), schedule.displayName()));
            }
        }
        tasks.sort(Comparator.comparing((AggregatedTask t) -> t.task().startTime())
                .thenComparing(t -> t.task().taskId())
                .thenComparing(AggregatedTask::assignedTo));
        return new AggregatedSchedule(tasks, workers, workers.size(), teamName);
    }

    // worker ids are "{teamSkillKey}_{position}"
    private static WorkerSchedule describe(String workerId, List<ScheduledTask> tasks) {
        int sep = workerId.lastIndexOf('_');
        Integer position = null;
        String teamSkillKey = workerId;
        if (sep > 0) {
            try {
                position = Integer.parseInt(workerId.substring(sep + 1));
                teamSkillKey = workerId.substring(0, sep);
            } catch (NumberFormatException e) {
                logger.debug("Worker id {} has no numeric position suffix", workerId);
            }
        }
        TeamSkillLabel label = TeamSkillLabel.parse(teamSkillKey);
        WorkerRole role = label.role();
        String displayName = position == null
                ? workerId
                : Worker.displayName(role, position, label.baseTeam(), label.skill());
        return new WorkerSchedule(workerId, displayName, label.baseTeam(), label.raw(), label.skill(), role,
                role == WorkerRole.QUALITY, role == WorkerRole.CUSTOMER, tasks);
    }
}
