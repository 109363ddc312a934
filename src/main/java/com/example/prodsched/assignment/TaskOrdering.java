package com.example.prodsched.assignment;

import com.example.prodsched.task.Task;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Order in which tasks are fed to the matcher. Assignment results depend on it,
 * so callers choose it explicitly.
 */
public enum TaskOrdering {
    /** Keep the caller's order. */
    AS_GIVEN(null),
    /** Dashboard display order: most urgent first, then earliest start. */
    PRIORITY_THEN_START(Comparator.comparingInt(Task::priorityOrDefault)
            .thenComparing(Task::startTime, Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))),
    START_THEN_PRIORITY(Comparator.comparing(Task::startTime, Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))
            .thenComparingInt(Task::priorityOrDefault));

    private final Comparator<Task> comparator;

    TaskOrdering(Comparator<Task> comparator) {
        this.comparator = comparator;
    }

    // stable: equal keys keep their relative input order; null rows sort last
    public List<Task> apply(List<Task> tasks) {
        List<Task> ordered = new ArrayList<>(tasks);
        if (comparator != null) {
            ordered.sort(Comparator.nullsLast(comparator));
        }
        return Collections.unmodifiableList(ordered);
    }
}
