package com.example.prodsched.assignment;

import com.example.prodsched.common.SkippedRecord;
import com.example.prodsched.task.ClassifiedTask;
import com.example.prodsched.task.RoleRequirement;
import com.example.prodsched.workforce.Worker;
import com.example.prodsched.workforce.WorkerPool;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable context of a single assignment run. Owns the worker pool's
 * availability for the run's lifetime and is discarded afterwards.
 */
class AssignmentRun {

    private final WorkerPool pool;
    private final Map<String, AssignmentRecord> records = new LinkedHashMap<>();
    private final List<TaskAssignmentResult> results = new ArrayList<>();
    private final List<SkippedRecord> skipped = new ArrayList<>();
    private final Set<String> seenTaskIds = new HashSet<>();
    private int fullCount;
    private int partialCount;
    private int conflictCount;

    AssignmentRun(WorkerPool pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.skipped.addAll(pool.getSkipped());
    }

    /** Returns false when the task id was already processed in this run. */
    boolean markSeen(String taskId) {
        return seenTaskIds.add(taskId);
    }

    void skip(String taskId, String reason) {
        skipped.add(SkippedRecord.task(taskId, reason));
        results.add(new TaskAssignmentResult(taskId, null, AssignmentOutcome.SKIPPED, List.of(), 0, reason));
    }

    TaskAssignmentResult assign(ClassifiedTask task) {
        int needed = task.requiredWorkers();
        List<Worker> candidates = new ArrayList<>();
        for (Worker worker : pool.workers()) {
            if (isCandidate(worker, task)) {
                candidates.add(worker);
                if (candidates.size() >= needed) {
                    break;
                }
            }
        }
        candidates.sort(rankFor(task));

        int count = Math.min(needed, candidates.size());
        List<String> assigned = new ArrayList<>(count);
        for (int slot = 0; slot < count; slot++) {
            Worker worker = candidates.get(slot);
            worker.commit(task.taskId(), task.startTime(), task.endTime());
            assigned.add(worker.getId());
        }

        TaskAssignmentResult result;
        if (count == 0) {
            conflictCount++;
            result = new TaskAssignmentResult(task.taskId(), task.team(), AssignmentOutcome.CONFLICT, List.of(), needed,
                    "no available " + task.effectiveRole().getLabel() + " for " + task.teamSkillKey());
        } else {
            records.put(task.taskId(), new AssignmentRecord(task.taskId(), assigned, task.team(),
                    task.teamSkillKey(), task.skill(), needed, task.customerTask()));
            if (count == needed) {
                fullCount++;
                result = new TaskAssignmentResult(task.taskId(), task.team(), AssignmentOutcome.FULL, assigned, needed, null);
            } else {
                partialCount++;
                result = new TaskAssignmentResult(task.taskId(), task.team(), AssignmentOutcome.PARTIAL, assigned, needed,
                        "only " + count + " of " + needed + " workers available");
            }
        }
        results.add(result);
        return result;
    }

    AssignmentRunResult finish() {
        return new AssignmentRunResult(records, results, fullCount, partialCount, conflictCount, skipped,
                pool.size(), pool.roleBreakdown());
    }

    static boolean isCandidate(Worker worker, ClassifiedTask task) {
        return matchesRequirement(worker, task) && worker.isAvailableAt(task.startTime());
    }

    static boolean matchesRequirement(Worker worker, ClassifiedTask task) {
        if (worker.getRole() != task.effectiveRole()) {
            return false;
        }
        if (task.requirement() != RoleRequirement.TEAM) {
            return true;
        }
        if (worker.getTeamSkillKey().equals(task.teamSkillKey())) {
            return true;
        }
        if (!task.hasSkill() && worker.getBaseTeam().equals(task.team())) {
            return true;
        }
        return worker.getBaseTeam().equals(task.team())
                && (!task.hasSkill() || task.skill().equals(worker.getSkill()));
    }

    // exact skill match first, then team position
    static Comparator<Worker> rankFor(ClassifiedTask task) {
        Comparator<Worker> bySkill = Comparator.comparingInt(
                w -> task.hasSkill() && task.skill().equals(w.getSkill()) ? 0 : 1);
        return bySkill.thenComparingInt(Worker::getPosition);
    }
}
