package com.example.prodsched.workforce;

import java.time.LocalDateTime;

public record TaskCommitment(String taskId, LocalDateTime startTime, LocalDateTime endTime) {

    public boolean overlaps(TaskCommitment other) {
        return startTime.isBefore(other.endTime) && other.startTime.isBefore(endTime);
    }
}
