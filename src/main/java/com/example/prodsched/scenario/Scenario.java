package com.example.prodsched.scenario;

import com.example.prodsched.task.Task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only scenario data: the scheduled tasks and the team-skill capacity
 * table. Capacity iteration order is preserved; it drives worker pool order.
 */
public record Scenario(String id, String name, List<Task> tasks, Map<String, Integer> teamCapacities) {

    public Scenario {
        tasks = tasks == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(tasks));
        teamCapacities = teamCapacities == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(teamCapacities));
    }

    public Scenario withId(String newId) {
        return new Scenario(newId, name, tasks, teamCapacities);
    }

    /** Tasks keyed by id; the first occurrence of a duplicated id wins. */
    public Map<String, Task> taskTable() {
        Map<String, Task> table = new LinkedHashMap<>();
        for (Task task : tasks) {
            if (task != null && task.taskId() != null) {
                table.putIfAbsent(task.taskId(), task);
            }
        }
        return table;
    }
}
