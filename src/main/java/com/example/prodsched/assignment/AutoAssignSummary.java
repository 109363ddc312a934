package com.example.prodsched.assignment;

import com.example.prodsched.common.SkippedRecord;
import com.example.prodsched.schedule.WorkerSummary;

import java.util.List;
import java.util.Map;

public record AutoAssignSummary(
        String scenarioId,
        String team,
        String skill,
        TaskOrdering ordering,
        int totalTasks,
        int fullCount,
        int partialCount,
        int conflictCount,
        int totalWorkers,
        Map<String, Integer> roles,
        List<TaskAssignmentResult> results,
        List<SkippedRecord> skipped,
        List<TeamStatistics> teamStatistics,
        List<WorkerSummary> workerSummaries) {

    public String message() {
        return "Assigned " + fullCount + " tasks fully, " + partialCount + " partially, with "
                + conflictCount + " conflicts";
    }
}
