package com.example.prodsched.schedule;

public record ScheduleOverlap(String firstTaskId, String secondTaskId, long overlapMinutes) {
}
