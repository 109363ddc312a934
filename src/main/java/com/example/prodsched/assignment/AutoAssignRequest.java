package com.example.prodsched.assignment;

/**
 * Filter context of an auto-assign run. Every field is optional; {@code null}
 * team or skill means "all".
 */
public record AutoAssignRequest(String team, String skill, TaskOrdering ordering, String shift, String product) {

    public static AutoAssignRequest all() {
        return new AutoAssignRequest(null, null, null, null, null);
    }
}
