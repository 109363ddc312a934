package com.example.prodsched.workforce;

public record SkillFilter(String skill) {

    public static final SkillFilter ALL = new SkillFilter(null);

    public static SkillFilter parse(String value) {
        if (value == null || value.isBlank() || "all".equalsIgnoreCase(value.trim())) {
            return ALL;
        }
        return new SkillFilter(value.trim());
    }

    public boolean isAll() {
        return skill == null;
    }

    // labels without a skill suffix serve any skill
    public boolean matches(TeamSkillLabel label) {
        return isAll() || !label.hasSkill() || skill.equals(label.skill());
    }

    public boolean matchesSkill(String candidate) {
        return isAll() || skill.equals(candidate);
    }

    @Override
    public String toString() {
        return isAll() ? "all" : skill;
    }
}
