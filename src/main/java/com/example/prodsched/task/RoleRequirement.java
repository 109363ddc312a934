package com.example.prodsched.task;

public enum RoleRequirement {
    CUSTOMER,
    QUALITY,
    /** No explicit role marker; the role follows from the task's team. */
    TEAM
}
