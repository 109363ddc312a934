package com.example.prodsched.schedule;

import java.util.List;

public record WorkerScheduleView(WorkerSchedule schedule, int totalTasks, List<ScheduleOverlap> overlaps) {

    public WorkerScheduleView {
        overlaps = List.copyOf(overlaps);
    }

    public boolean hasOverlaps() {
        return !overlaps.isEmpty();
    }
}
