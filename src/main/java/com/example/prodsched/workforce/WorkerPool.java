package com.example.prodsched.workforce;

import com.example.prodsched.common.SkippedRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Workers keyed by id in expansion order. Iteration order is the candidate
 * scan order of the matcher.
 */
public class WorkerPool {

    private final Map<String, Worker> workers = new LinkedHashMap<>();
    private final List<SkippedRecord> skipped;

    WorkerPool(List<Worker> workers, List<SkippedRecord> skipped) {
        for (Worker w : workers) {
            if (this.workers.putIfAbsent(w.getId(), w) != null) {
                throw new IllegalArgumentException("duplicate worker id " + w.getId());
            }
        }
        this.skipped = List.copyOf(skipped);
    }

    public Collection<Worker> workers() {
        return Collections.unmodifiableCollection(workers.values());
    }

    public int size() {
        return workers.size();
    }

    /** Capacity entries rejected while expanding this pool. */
    public List<SkippedRecord> getSkipped() {
        return skipped;
    }

    public Map<WorkerRole, Integer> roleBreakdown() {
        Map<WorkerRole, Integer> counts = new EnumMap<>(WorkerRole.class);
        for (Worker w : workers.values()) {
            counts.merge(w.getRole(), 1, Integer::sum);
        }
        return counts;
    }
}
