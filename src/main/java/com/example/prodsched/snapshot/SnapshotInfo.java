package com.example.prodsched.snapshot;

import java.time.LocalDateTime;

public record SnapshotInfo(String scenarioId, int recordCount, LocalDateTime savedAt) {

    static SnapshotInfo from(AssignmentSnapshot snapshot) {
        return new SnapshotInfo(snapshot.getScenarioId(),
                snapshot.getRecordCount() == null ? 0 : snapshot.getRecordCount(),
                snapshot.getSavedAt());
    }
}
