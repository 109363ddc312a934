package com.example.prodsched.snapshot;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;

import java.time.LocalDateTime;

/**
 * Saved copy of one scenario's assignment map. The payload is stored as an
 * opaque JSON document.
 */
@Entity
@Table(name = "assignment_snapshots")
public class AssignmentSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Column(name = "scenario_id", nullable = false, unique = true, length = 128)
    private String scenarioId;

    @Lob
    @Column(name = "payload", nullable = false)
    private String payload;

    @Column(name = "record_count")
    private Integer recordCount;

    @Column(name = "saved_at")
    private LocalDateTime savedAt;

    protected AssignmentSnapshot() {}

    public AssignmentSnapshot(String scenarioId, String payload, int recordCount) {
        this.scenarioId = scenarioId;
        this.payload = payload;
        this.recordCount = recordCount;
    }

    @PrePersist
    @PreUpdate
    protected void onSave() { this.savedAt = LocalDateTime.now(); }

    public Long getId() { return id; }
    public String getScenarioId() { return scenarioId; }
    public String getPayload() { return payload; }
    public void setPayload(String payload) { this.payload = payload; }
    public Integer getRecordCount() { return recordCount; }
    public void setRecordCount(Integer recordCount) { this.recordCount = recordCount; }
    public LocalDateTime getSavedAt() { return savedAt; }
}
