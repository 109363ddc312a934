package com.example.prodsched.schedule;

import com.example.prodsched.workforce.WorkerRole;

import java.time.LocalDateTime;

public record WorkerSummary(
        String workerId,
        String displayName,
        String team,
        String skill,
        WorkerRole role,
        int taskCount,
        double utilizationHours,
        LocalDateTime lastTaskEnd) {

    public static WorkerSummary of(WorkerSchedule schedule) {
        return new WorkerSummary(schedule.workerId(), schedule.displayName(), schedule.team(), schedule.skill(),
                schedule.role(), schedule.tasks().size(), schedule.utilizationHours(), schedule.lastTaskEnd());
    }
}
