package com.example.prodsched.workforce;

import com.example.prodsched.common.SkippedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Expands a team-skill capacity table into addressable workers, one per unit of
 * capacity, for the labels passing the active team and skill filters.
 */
@Component
public class CapacityExpander {

    private static final Logger logger = LoggerFactory.getLogger(CapacityExpander.class);

    public WorkerPool buildWorkerPool(Map<String, Integer> capacities, TeamFilter teamFilter, SkillFilter skillFilter) {
        Objects.requireNonNull(capacities, "capacities");
        TeamFilter teams = teamFilter == null ? TeamFilter.ALL : teamFilter;
        SkillFilter skills = skillFilter == null ? SkillFilter.ALL : skillFilter;

        List<Worker> workers = new ArrayList<>();
        List<SkippedRecord> skipped = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : capacities.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank()) {
                skipped.add(SkippedRecord.capacity(String.valueOf(key), "blank team-skill label"));
                continue;
            }
            int capacity = entry.getValue() == null ? 0 : entry.getValue();
            if (capacity < 0) {
                logger.warn("Skipping capacity entry '{}' with negative capacity {}", key, capacity);
                skipped.add(SkippedRecord.capacity(key, "negative capacity " + capacity));
                continue;
            }
            TeamSkillLabel label = TeamSkillLabel.parse(key);
            if (capacity == 0 || !teams.matches(label) || !skills.matches(label)) {
                continue;
            }
            for (int position = 1; position <= capacity; position++) {
                workers.add(new Worker(label, position));
            }
        }
        logger.debug("Built worker pool of {} workers (team={}, skill={})", workers.size(), teams, skills);
        return new WorkerPool(workers, skipped);
    }
}
