package com.example.prodsched.assignment;

import com.example.prodsched.common.SkippedRecord;
import com.example.prodsched.workforce.WorkerRole;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one assignment run: the records written, one result per input task
 * in input order, summary counts and skipped-record diagnostics.
 */
public record AssignmentRunResult(
        Map<String, AssignmentRecord> records,
        List<TaskAssignmentResult> results,
        int fullCount,
        int partialCount,
        int conflictCount,
        List<SkippedRecord> skipped,
        int totalWorkers,
        Map<WorkerRole, Integer> roleBreakdown) {

    public AssignmentRunResult {
        records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
        results = List.copyOf(results);
        skipped = List.copyOf(skipped);
        roleBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(roleBreakdown));
    }

    public List<String> conflictTaskIds() {
        return results.stream()
                .filter(r -> r.outcome() == AssignmentOutcome.CONFLICT)
                .map(TaskAssignmentResult::taskId)
                .toList();
    }
}
