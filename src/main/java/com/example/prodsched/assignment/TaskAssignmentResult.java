package com.example.prodsched.assignment;

import java.util.List;

public record TaskAssignmentResult(String taskId, String team, AssignmentOutcome outcome, List<String> workerIds,
                                   int requiredWorkers, String reason) {

    public TaskAssignmentResult {
        workerIds = workerIds == null ? List.of() : List.copyOf(workerIds);
    }
}
