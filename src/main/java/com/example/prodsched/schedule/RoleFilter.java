package com.example.prodsched.schedule;

import com.example.prodsched.workforce.WorkerRole;

import java.util.Locale;

public enum RoleFilter {
    ALL("all"),
    MECHANICS("all-mechanics"),
    QUALITY("all-quality"),
    CUSTOMER("all-customer");

    private final String value;

    RoleFilter(String value) {
        this.value = value;
    }

    public static RoleFilter parse(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (RoleFilter f : values()) {
            if (f.value.equals(v) || f.name().toLowerCase(Locale.ROOT).equals(v)) {
                return f;
            }
        }
        throw new IllegalArgumentException("Unknown role filter: " + value);
    }

    public boolean matches(WorkerRole role) {
        return switch (this) {
            case ALL -> true;
            case MECHANICS -> role == WorkerRole.MECHANIC;
            case QUALITY -> role == WorkerRole.QUALITY;
            case CUSTOMER -> role == WorkerRole.CUSTOMER;
        };
    }
}
