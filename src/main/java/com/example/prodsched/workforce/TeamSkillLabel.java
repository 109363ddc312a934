package com.example.prodsched.workforce;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A team-skill label such as {@code "Mechanic Team 3 (Avionics)"}: a base team
 * with an optional parenthetical skill code.
 */
public record TeamSkillLabel(String raw, String baseTeam, String skill) {

    private static final Pattern SUFFIX = Pattern.compile("^(.+?)\\s*\\((.+?)\\)\\s*$");

    public TeamSkillLabel {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(baseTeam, "baseTeam");
    }

    public static TeamSkillLabel parse(String label) {
        Objects.requireNonNull(label, "label");
        Matcher m = SUFFIX.matcher(label);
        if (m.matches()) {
            return new TeamSkillLabel(label, m.group(1).trim(), m.group(2).trim());
        }
        return new TeamSkillLabel(label, label.trim(), null);
    }

    public static TeamSkillLabel of(String team, String skill) {
        if (skill == null || skill.isBlank()) {
            return new TeamSkillLabel(team, team, null);
        }
        return new TeamSkillLabel(team + " (" + skill + ")", team, skill);
    }

    public boolean hasSkill() {
        return skill != null;
    }

    public WorkerRole role() {
        return WorkerRole.classify(baseTeam);
    }
}
