package com.example.prodsched.assignment;

import com.example.prodsched.task.ClassifiedTask;
import com.example.prodsched.task.Task;
import com.example.prodsched.task.TaskClassifier;
import com.example.prodsched.workforce.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-pass greedy assignment. Tasks are processed strictly in the supplied
 * order; each takes the first adequate available workers in pool order, ranked
 * by skill match and team position. No backtracking.
 */
@Component
public class AssignmentMatcher {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentMatcher.class);

    private final TaskClassifier classifier;

    public AssignmentMatcher(TaskClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Assigns workers from {@code pool} to {@code orderedTasks} in list order.
     * The pool's availability state is consumed by the run; pass a fresh pool per run.
     */
    public AssignmentRunResult runAssignment(List<Task> orderedTasks, WorkerPool pool) {
        Objects.requireNonNull(orderedTasks, "orderedTasks");
        Objects.requireNonNull(pool, "pool");

        AssignmentRun run = new AssignmentRun(pool);
        for (Task task : orderedTasks) {
            String taskId = task == null ? null : task.taskId();
            // first occurrence of an id wins, whether or not it is well formed
            if (taskId != null && !taskId.isBlank() && !run.markSeen(taskId)) {
                logger.warn("Skipping duplicate task {}", taskId);
                run.skip(taskId, "duplicate task id");
                continue;
            }
            Optional<String> invalid = classifier.validate(task);
            if (invalid.isPresent()) {
                logger.warn("Skipping task {}: {}", taskId, invalid.get());
                run.skip(taskId, invalid.get());
                continue;
            }
            ClassifiedTask classified = classifier.classify(task);
            TaskAssignmentResult result = run.assign(classified);
            if (result.outcome() == AssignmentOutcome.CONFLICT) {
                logger.debug("No workers available for task {} (team={}, skill={}, role={})",
                        taskId, classified.teamSkillKey(), classified.skill(), classified.effectiveRole());
            }
        }

        AssignmentRunResult result = run.finish();
        logger.info("Assignment run finished: full={}, partial={}, conflicts={}, skipped={}, workers={}",
                result.fullCount(), result.partialCount(), result.conflictCount(),
                result.skipped().size(), result.totalWorkers());
        return result;
    }
}
