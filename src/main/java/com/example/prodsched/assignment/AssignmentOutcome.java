package com.example.prodsched.assignment;

public enum AssignmentOutcome {
    FULL,
    PARTIAL,
    /** No available matching worker. */
    CONFLICT,
    /** Rejected as malformed input. */
    SKIPPED
}
