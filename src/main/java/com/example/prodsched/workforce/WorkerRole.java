package com.example.prodsched.workforce;

import java.util.Locale;

public enum WorkerRole {
    MECHANIC("Mechanic", "Mechanic"),
    QUALITY("Inspector", "Quality Inspector"),
    CUSTOMER("Customer", "Customer");

    private final String displayPrefix;
    private final String label;

    WorkerRole(String displayPrefix, String label) {
        this.displayPrefix = displayPrefix;
        this.label = label;
    }

    public String getDisplayPrefix() { return displayPrefix; }
    public String getLabel() { return label; }

    /**
     * Classifies a team name by substring: "customer" wins over "quality",
     * anything else is a mechanic team.
     */
    public static WorkerRole classify(String team) {
        if (team == null) {
            return MECHANIC;
        }
        String lower = team.toLowerCase(Locale.ROOT);
        if (lower.contains("customer")) {
            return CUSTOMER;
        }
        if (lower.contains("quality")) {
            return QUALITY;
        }
        return MECHANIC;
    }
}
