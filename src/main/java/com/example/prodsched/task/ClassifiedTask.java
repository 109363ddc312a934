package com.example.prodsched.task;

import com.example.prodsched.workforce.TeamSkillLabel;
import com.example.prodsched.workforce.WorkerRole;

import java.time.LocalDateTime;

public record ClassifiedTask(
        Task task,
        TeamSkillLabel teamSkill,
        RoleRequirement requirement,
        boolean customerTask,
        boolean qualityTask,
        boolean latePartTask,
        boolean reworkTask,
        boolean critical) {

    public String taskId() { return task.taskId(); }
    public String team() { return teamSkill.baseTeam(); }
    public String skill() { return teamSkill.skill(); }
    public String teamSkillKey() { return teamSkill.raw(); }
    public int requiredWorkers() { return task.requiredWorkersOrDefault(); }
    public LocalDateTime startTime() { return task.startTime(); }
    public LocalDateTime endTime() { return task.endTime(); }

    public boolean hasSkill() {
        return teamSkill.hasSkill();
    }

    public WorkerRole effectiveRole() {
        return switch (requirement) {
            case CUSTOMER -> WorkerRole.CUSTOMER;
            case QUALITY -> WorkerRole.QUALITY;
            case TEAM -> teamSkill.role();
        };
    }
}
