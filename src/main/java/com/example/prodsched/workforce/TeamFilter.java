package com.example.prodsched.workforce;

import java.util.Locale;

/**
 * Team selection of the dashboard: every team, every team of one role, or a
 * single base team.
 */
public record TeamFilter(Kind kind, String team) {

    public enum Kind { ALL, ALL_MECHANICS, ALL_QUALITY, ALL_CUSTOMER, TEAM }

    public static final TeamFilter ALL = new TeamFilter(Kind.ALL, null);

    public static TeamFilter parse(String value) {
        if (value == null || value.isBlank() || "all".equalsIgnoreCase(value.trim())) {
            return ALL;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "all-mechanics" -> new TeamFilter(Kind.ALL_MECHANICS, null);
            case "all-quality" -> new TeamFilter(Kind.ALL_QUALITY, null);
            case "all-customer" -> new TeamFilter(Kind.ALL_CUSTOMER, null);
            default -> new TeamFilter(Kind.TEAM, value.trim());
        };
    }

    public boolean matches(TeamSkillLabel label) {
        String lower = label.raw().toLowerCase(Locale.ROOT);
        return switch (kind) {
            case ALL -> true;
            case ALL_MECHANICS -> lower.contains("mechanic") && !lower.contains("quality") && !lower.contains("customer");
            case ALL_QUALITY -> lower.contains("quality");
            case ALL_CUSTOMER -> lower.contains("customer");
            case TEAM -> label.baseTeam().equals(team) || label.raw().equals(team);
        };
    }

    /** Task selection by role; a single-team filter compares base teams. */
    public boolean matchesTask(String baseTeam, WorkerRole effectiveRole) {
        return switch (kind) {
            case ALL -> true;
            case ALL_MECHANICS -> effectiveRole == WorkerRole.MECHANIC;
            case ALL_QUALITY -> effectiveRole == WorkerRole.QUALITY;
            case ALL_CUSTOMER -> effectiveRole == WorkerRole.CUSTOMER;
            case TEAM -> team.equals(baseTeam);
        };
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ALL -> "all";
            case ALL_MECHANICS -> "all-mechanics";
            case ALL_QUALITY -> "all-quality";
            case ALL_CUSTOMER -> "all-customer";
            case TEAM -> team;
        };
    }
}
