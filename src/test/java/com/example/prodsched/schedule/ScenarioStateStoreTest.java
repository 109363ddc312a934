package com.example.prodsched.schedule;

import com.example.prodsched.assignment.AssignmentRecord;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScenarioStateStoreTest {

    private final ScenarioStateStore store = new ScenarioStateStore();

    @Test
    void getOrCreate_returnsSameStatePerScenario() {
        assertThat(store.getOrCreate("a")).isSameAs(store.getOrCreate("a"));
        assertThat(store.getOrCreate("a")).isNotSameAs(store.getOrCreate("b"));
    }

    @Test
    void clearScenarioAssignments_leavesOtherScenariosUntouched() {
        AssignmentRecord record = new AssignmentRecord("T1", List.of("Mechanic Team 1_1"), "Mechanic Team 1",
                "Mechanic Team 1", null, 1, false);
        store.getOrCreate("a").putRecord(record);
        store.getOrCreate("b").putRecord(record);

        store.clearScenarioAssignments("a");

        assertThat(store.getOrCreate("a").getRecords()).isEmpty();
        assertThat(store.getOrCreate("b").getRecords()).containsOnlyKeys("T1");
    }

    @Test
    void assignmentRecord_derivesPartialFromFilledSlots() {
        AssignmentRecord record = new AssignmentRecord("T2", Arrays.asList("w1", null, ""),
                "Mechanic Team 1", "Mechanic Team 1", null, 3, false);

        assertThat(record.workerIds()).containsExactly("w1", "", "");
        assertThat(record.filledCount()).isEqualTo(1);
        assertThat(record.isPartial()).isTrue();
        assertThat(record.withWorkerIds(List.of("w1", "w2", "w3")).isPartial()).isFalse();
        assertThat(record.withWorkerIds(List.of()).isPartial()).isFalse();
    }
}
