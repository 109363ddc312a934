package com.example.prodsched.schedule;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/** Denormalized task entry of a worker schedule. */
public record ScheduledTask(
        String taskId,
        LocalDateTime startTime,
        LocalDateTime endTime,
        String type,
        String product,
        int durationMinutes,
        String team,
        String teamSkill,
        String skill,
        @JsonProperty("isCustomerTask") boolean isCustomerTask) {
}
