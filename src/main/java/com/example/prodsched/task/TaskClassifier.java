package com.example.prodsched.task;

import com.example.prodsched.config.AssignmentSettings;
import com.example.prodsched.workforce.TeamSkillLabel;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Derives role requirement, team, skill and category flags for a task. Each
 * flag is the OR of the explicit source flag, a type label and an id marker.
 */
@Component
public class TaskClassifier {

    private final AssignmentSettings settings;

    public TaskClassifier(AssignmentSettings settings) {
        this.settings = settings;
    }

    /**
     * Returns the reason a task cannot take part in an assignment run, or empty
     * when it is well formed.
     */
    public Optional<String> validate(Task task) {
        if (task == null) {
            return Optional.of("null task");
        }
        if (isBlank(task.taskId())) {
            return Optional.of("missing task id");
        }
        if (isBlank(task.team()) && isBlank(task.teamSkill())) {
            return Optional.of("missing team");
        }
        if (task.requiredWorkersOrDefault() < 1) {
            return Optional.of("requiredWorkers must be at least 1 but was " + task.requiredWorkers());
        }
        if (task.startTime() == null || task.endTime() == null) {
            return Optional.of("missing start or end time");
        }
        if (!task.endTime().isAfter(task.startTime())) {
            return Optional.of("endTime " + task.endTime() + " is not after startTime " + task.startTime());
        }
        return Optional.empty();
    }

    public ClassifiedTask classify(Task task) {
        TeamSkillLabel label = normalizeTeamSkill(task);
        String id = task.taskId() == null ? "" : task.taskId();
        String type = task.type();

        boolean customer = isTrue(task.isCustomerTask())
                || (type != null && settings.getCustomerTypes().contains(type))
                || id.contains(settings.getCustomerMarker());
        boolean quality = isTrue(task.isQualityTask())
                || settings.getQualityType().equals(type)
                || id.contains(settings.getQualityMarker());
        boolean latePart = isTrue(task.isLatePartTask())
                || settings.getLatePartType().equals(type)
                || id.startsWith(settings.getLatePartPrefix());
        boolean rework = isTrue(task.isReworkTask())
                || settings.getReworkType().equals(type)
                || id.startsWith(settings.getReworkPrefix());
        boolean critical = isTrue(task.isCritical())
                || (task.slackHours() != null && task.slackHours() < settings.getCriticalSlackHours());

        RoleRequirement requirement;
        if (customer) {
            requirement = RoleRequirement.CUSTOMER;
        } else if (quality) {
            requirement = RoleRequirement.QUALITY;
        } else {
            requirement = RoleRequirement.TEAM;
        }
        return new ClassifiedTask(task, label, requirement, customer, quality, latePart, rework, critical);
    }

    static TeamSkillLabel normalizeTeamSkill(Task task) {
        String key = isBlank(task.teamSkill()) ? task.team() : task.teamSkill();
        TeamSkillLabel parsed = TeamSkillLabel.parse(key.trim());
        if (isBlank(task.skill())) {
            return parsed;
        }
        return TeamSkillLabel.of(parsed.baseTeam(), task.skill().trim());
    }

    private static boolean isTrue(Boolean b) {
        return b != null && b;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
