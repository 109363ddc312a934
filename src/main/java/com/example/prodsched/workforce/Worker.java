package com.example.prodsched.workforce;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * One unit of assignable capacity. Availability state is mutable and lives only
 * for the assignment run that created the worker.
 */
public class Worker {

    private final String id;
    private final TeamSkillLabel label;
    private final WorkerRole role;
    private final int position;
    private LocalDateTime busyUntil;
    private final List<TaskCommitment> assignedTasks = new ArrayList<>();

    public Worker(TeamSkillLabel label, int position) {
        this.label = Objects.requireNonNull(label, "label");
        if (position < 1) {
            throw new IllegalArgumentException("position must be 1-based: " + position);
        }
        this.position = position;
        this.id = idFor(label.raw(), position);
        this.role = label.role();
    }

    public static String idFor(String teamSkillKey, int position) {
        return teamSkillKey + "_" + position;
    }

    public static String displayName(WorkerRole role, int position, String baseTeam, String skill) {
        String name = role.getDisplayPrefix() + " #" + position + " - " + baseTeam;
        return skill == null ? name : name + " (" + skill + ")";
    }

    public boolean isAvailableAt(LocalDateTime time) {
        return busyUntil == null || !busyUntil.isAfter(time);
    }

    public void commit(String taskId, LocalDateTime start, LocalDateTime end) {
        busyUntil = end;
        assignedTasks.add(new TaskCommitment(taskId, start, end));
        assignedTasks.sort(Comparator.comparing(TaskCommitment::startTime));
    }

    public String getId() { return id; }
    public String getTeamSkillKey() { return label.raw(); }
    public String getBaseTeam() { return label.baseTeam(); }
    public String getSkill() { return label.skill(); }
    public WorkerRole getRole() { return role; }
    public int getPosition() { return position; }
    public LocalDateTime getBusyUntil() { return busyUntil; }
    public List<TaskCommitment> getAssignedTasks() { return Collections.unmodifiableList(assignedTasks); }

    public String getDisplayName() {
        return displayName(role, position, label.baseTeam(), label.skill());
    }

    @Override
    public String toString() {
        return "Worker{" + id + ", busyUntil=" + busyUntil + "}";
    }
}
