package com.example.prodsched.task;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * A scheduled task as supplied by the scenario data source. Read-only; derived
 * classification lives on {@link ClassifiedTask}.
 */
public record Task(
        @JsonAlias("id") String taskId,
        String team,
        String teamSkill,
        String skill,
        String type,
        String product,
        @JsonAlias("mechanics") Integer requiredWorkers,
        LocalDateTime startTime,
        LocalDateTime endTime,
        @JsonAlias("duration") Integer durationMinutes,
        Integer priority,
        String shift,
        Double slackHours,
        @JsonProperty("isCustomerTask") Boolean isCustomerTask,
        @JsonProperty("isQualityTask") Boolean isQualityTask,
        @JsonProperty("isLatePartTask") Boolean isLatePartTask,
        @JsonProperty("isReworkTask") Boolean isReworkTask,
        @JsonProperty("isCritical") Boolean isCritical) {

    public static Task of(String taskId, String team, String skill, int requiredWorkers,
                          LocalDateTime startTime, LocalDateTime endTime, int priority) {
        return new Task(taskId, team, null, skill, "Production", null, requiredWorkers, startTime, endTime,
                null, priority, null, null, null, null, null, null, null);
    }

    public Task withType(String newType) {
        return new Task(taskId, team, teamSkill, skill, newType, product, requiredWorkers, startTime, endTime,
                durationMinutes, priority, shift, slackHours, isCustomerTask, isQualityTask, isLatePartTask,
                isReworkTask, isCritical);
    }

    public Task withFlags(Boolean customer, Boolean quality) {
        return new Task(taskId, team, teamSkill, skill, type, product, requiredWorkers, startTime, endTime,
                durationMinutes, priority, shift, slackHours, customer, quality, isLatePartTask,
                isReworkTask, isCritical);
    }

    public int requiredWorkersOrDefault() {
        return requiredWorkers == null ? 1 : requiredWorkers;
    }

    public int priorityOrDefault() {
        return priority == null ? 999 : priority;
    }

    public int effectiveDurationMinutes() {
        if (durationMinutes != null) {
            return durationMinutes;
        }
        if (startTime == null || endTime == null) {
            return 0;
        }
        return (int) Duration.between(startTime, endTime).toMinutes();
    }
}
