package com.example.prodsched.schedule;

import com.example.prodsched.workforce.WorkerRole;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

public record WorkerSchedule(
        String workerId,
        String displayName,
        String team,
        String teamSkill,
        String skill,
        WorkerRole role,
        @JsonProperty("isQuality") boolean isQuality,
        @JsonProperty("isCustomer") boolean isCustomer,
        List<ScheduledTask> tasks) {

    public WorkerSchedule {
        tasks = List.copyOf(tasks);
    }

    public double utilizationHours() {
        return tasks.stream().mapToInt(ScheduledTask::durationMinutes).sum() / 60.0;
    }

    public LocalDateTime lastTaskEnd() {
        return tasks.stream().map(ScheduledTask::endTime).max(LocalDateTime::compareTo).orElse(null);
    }
}
