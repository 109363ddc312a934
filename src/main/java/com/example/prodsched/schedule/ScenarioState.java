package com.example.prodsched.schedule;

import com.example.prodsched.assignment.AssignmentRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assignment records and derived worker schedules of one scenario. Callers that
 * read-modify-write the state synchronize on the instance.
 */
public class ScenarioState {

    private final String scenarioId;
    private final Map<String, AssignmentRecord> records = new LinkedHashMap<>();
    private Map<String, WorkerSchedule> workerSchedules = Map.of();

    public ScenarioState(String scenarioId) {
        this.scenarioId = scenarioId;
    }

    public String getScenarioId() {
        return scenarioId;
    }

    public synchronized Map<String, AssignmentRecord> getRecords() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(records));
    }

    public synchronized void putRecord(AssignmentRecord record) {
        records.put(record.taskId(), record);
    }

    public synchronized void putRecords(Collection<AssignmentRecord> newRecords) {
        for (AssignmentRecord record : newRecords) {
            records.put(record.taskId(), record);
        }
    }

    public synchronized void removeRecord(String taskId) {
        records.remove(taskId);
    }

    public synchronized void replaceRecords(Map<String, AssignmentRecord> newRecords) {
        records.clear();
        records.putAll(newRecords);
    }

    public synchronized Map<String, WorkerSchedule> getWorkerSchedules() {
        return workerSchedules;
    }

    synchronized void setWorkerSchedules(Map<String, WorkerSchedule> schedules) {
        this.workerSchedules = Collections.unmodifiableMap(new LinkedHashMap<>(schedules));
    }

    public synchronized void clear() {
        records.clear();
        workerSchedules = Map.of();
    }
}
