package com.example.prodsched.schedule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record AggregatedSchedule(List<AggregatedTask> tasks, Map<String, WorkerSummary> workers,
                                 int totalWorkers, String teamName) {

    public AggregatedSchedule {
        tasks = List.copyOf(tasks);
        workers = Collections.unmodifiableMap(new LinkedHashMap<>(workers));
    }
}
