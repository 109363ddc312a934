package com.example.prodsched.assignment;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Persisted assignment of workers to one task. {@link #isPartial()} is always
 * derived from the filled slots and never stored on its own.
 */
public record AssignmentRecord(
        String taskId,
        List<String> workerIds,
        String team,
        String teamSkill,
        String skill,
        int requiredWorkers,
        boolean customerTask) {

    public AssignmentRecord {
        List<String> slots = new ArrayList<>();
        if (workerIds != null) {
            for (String id : workerIds) {
                slots.add(id == null ? "" : id);
            }
        }
        workerIds = Collections.unmodifiableList(slots);
    }

    @JsonIgnore
    public int filledCount() {
        return (int) workerIds.stream().filter(id -> !id.isBlank()).count();
    }

    @JsonIgnore
    public List<String> assignedWorkerIds() {
        return workerIds.stream().filter(id -> !id.isBlank()).toList();
    }

    @JsonProperty("partial")
    public boolean isPartial() {
        int filled = filledCount();
        return filled > 0 && filled < requiredWorkers;
    }

    @JsonIgnore
    public boolean isComplete() {
        return filledCount() >= requiredWorkers;
    }

    public AssignmentRecord withWorkerIds(List<String> newWorkerIds) {
        return new AssignmentRecord(taskId, newWorkerIds, team, teamSkill, skill, requiredWorkers, customerTask);
    }
}
