package com.example.prodsched.assignment;

/** Completion of a scenario's tasks, recomputed from the stored records. */
public record AssignmentProgress(int total, int complete, int partial, int unassigned, double progressPercent) {
}
