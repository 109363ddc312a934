package com.example.prodsched.common;

/**
 * Diagnostic for an input record rejected by a run. The run continues with the
 * remaining records.
 */
public record SkippedRecord(Kind kind, String reference, String reason) {

    public enum Kind { TASK, CAPACITY }

    public static SkippedRecord task(String taskId, String reason) {
        return new SkippedRecord(Kind.TASK, taskId, reason);
    }

    public static SkippedRecord capacity(String teamSkill, String reason) {
        return new SkippedRecord(Kind.CAPACITY, teamSkill, reason);
    }
}
