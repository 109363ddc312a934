package com.example.prodsched.snapshot;

import com.example.prodsched.assignment.AssignmentRecord;
import com.example.prodsched.exception.BusinessException;
import com.example.prodsched.scenario.Scenario;
import com.example.prodsched.scenario.ScenarioCatalog;
import com.example.prodsched.schedule.ScenarioState;
import com.example.prodsched.schedule.ScenarioStateStore;
import com.example.prodsched.schedule.ScheduleAggregator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Saves and restores a scenario's assignment map verbatim, so assignments
 * survive a restart.
 */
@Service
public class AssignmentSnapshotService {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentSnapshotService.class);
    private static final TypeReference<LinkedHashMap<String, AssignmentRecord>> RECORDS_TYPE = new TypeReference<>() {
    };

    private final AssignmentSnapshotRepository repository;
    private final ScenarioCatalog catalog;
    private final ScenarioStateStore stateStore;
    private final ScheduleAggregator aggregator;
    private final ObjectMapper mapper;

    public AssignmentSnapshotService(AssignmentSnapshotRepository repository,
                                     ScenarioCatalog catalog,
                                     ScenarioStateStore stateStore,
                                     ScheduleAggregator aggregator,
                                     ObjectMapper objectMapper) {
        this.repository = repository;
        this.catalog = catalog;
        this.stateStore = stateStore;
        this.aggregator = aggregator;
        this.mapper = objectMapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Transactional
    public SnapshotInfo save(String scenarioId) {
        catalog.require(scenarioId);
        Map<String, AssignmentRecord> records = stateStore.getOrCreate(scenarioId).getRecords();
        String payload;
        try {
            payload = mapper.writeValueAsString(records);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize assignments of scenario " + scenarioId, e);
        }
        AssignmentSnapshot snapshot = repository.findByScenarioId(scenarioId)
                .orElseGet(() -> new AssignmentSnapshot(scenarioId, payload, records.size()));
        snapshot.setPayload(payload);
        snapshot.setRecordCount(records.size());
        AssignmentSnapshot saved = repository.saveAndFlush(snapshot);
        logger.info("Saved {} assignment records of scenario {}", records.size(), scenarioId);
        return SnapshotInfo.from(saved);
    }

    /** Replaces the scenario's records with the saved copy and rebuilds worker schedules. */
    @Transactional(readOnly = true)
    public SnapshotInfo restore(String scenarioId) {
        Scenario scenario = catalog.require(scenarioId);
        AssignmentSnapshot snapshot = repository.findByScenarioId(scenarioId)
                .orElseThrow(() -> new BusinessException(BusinessException.SNAPSHOT_NOT_FOUND,
                        "No saved assignments for scenario " + scenarioId));
        Map<String, AssignmentRecord> records;
        try {
            records = mapper.readValue(snapshot.getPayload(), RECORDS_TYPE);
        } catch (JsonProcessingException e) {
            throw new BusinessException(BusinessException.SNAPSHOT_UNREADABLE,
                    "Saved assignments for scenario " + scenarioId + " could not be read", e);
        }
        ScenarioState state = stateStore.getOrCreate(scenarioId);
        synchronized (state) {
            state.replaceRecords(records);
            aggregator.rebuildWorkerSchedules(state, scenario.taskTable());
        }
        logger.info("Restored {} assignment records of scenario {}", records.size(), scenarioId);
        return SnapshotInfo.from(snapshot);
    }

    @Transactional
    public boolean delete(String scenarioId) {
        return repository.deleteByScenarioId(scenarioId) > 0;
    }
}
