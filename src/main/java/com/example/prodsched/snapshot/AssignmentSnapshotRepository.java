package com.example.prodsched.snapshot;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

public interface AssignmentSnapshotRepository extends JpaRepository<AssignmentSnapshot, Long> {

    Optional<AssignmentSnapshot> findByScenarioId(String scenarioId);

    @Modifying
    @Transactional
    long deleteByScenarioId(String scenarioId);
}
