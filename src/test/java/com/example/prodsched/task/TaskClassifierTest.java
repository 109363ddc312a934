package com.example.prodsched.task;

import com.example.prodsched.config.AssignmentSettings;
import com.example.prodsched.workforce.WorkerRole;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class TaskClassifierTest {

    private static final LocalDateTime NINE = LocalDateTime.of(2025, 8, 25, 9, 0);
    private static final LocalDateTime TEN = LocalDateTime.of(2025, 8, 25, 10, 0);

    private final TaskClassifier classifier = new TaskClassifier(AssignmentSettings.defaults());

    @Test
    void classify_plainProductionTaskRequiresItsTeam() {
        ClassifiedTask task = classifier.classify(Task.of("1001", "Mechanic Team 1", null, 1, NINE, TEN, 1));

        assertThat(task.requirement()).isEqualTo(RoleRequirement.TEAM);
        assertThat(task.effectiveRole()).isEqualTo(WorkerRole.MECHANIC);
        assertThat(task.customerTask()).isFalse();
        assertThat(task.qualityTask()).isFalse();
        assertThat(task.team()).isEqualTo("Mechanic Team 1");
        assertThat(task.hasSkill()).isFalse();
    }

    @Test
    void classify_customerFlagComesFromTypeIdOrExplicitFlag() {
        assertThat(classifier.classify(Task.of("5001", "Mechanic Team 1", null, 1, NINE, TEN, 1)
                .withType("Customer Inspection")).customerTask()).isTrue();
        assertThat(classifier.classify(Task.of("CC_5002", "Mechanic Team 1", null, 1, NINE, TEN, 1))
                .customerTask()).isTrue();
        assertThat(classifier.classify(Task.of("5003", "Mechanic Team 1", null, 1, NINE, TEN, 1)
                .withFlags(true, null)).customerTask()).isTrue();
    }

    @Test
    void classify_customerTakesPrecedenceOverQuality() {
        ClassifiedTask task = classifier.classify(Task.of("QI_CC_7", "Quality Team 1", null, 1, NINE, TEN, 1));

        assertThat(task.customerTask()).isTrue();
        assertThat(task.qualityTask()).isTrue();
        assertThat(task.requirement()).isEqualTo(RoleRequirement.CUSTOMER);
        assertThat(task.effectiveRole()).isEqualTo(WorkerRole.CUSTOMER);
    }

    @Test
    void classify_qualityInspectionTypeRequiresInspector() {
        ClassifiedTask task = classifier.classify(Task.of("4001", "Mechanic Team 2", null, 1, NINE, TEN, 1)
                .withType("Quality Inspection"));

        assertThat(task.requirement()).isEqualTo(RoleRequirement.QUALITY);
        assertThat(task.effectiveRole()).isEqualTo(WorkerRole.QUALITY);
    }

    @Test
    void classify_latePartAndReworkFlagsFromPrefixes() {
        ClassifiedTask latePart = classifier.classify(Task.of("LP_3001", "Mechanic Team 1", null, 1, NINE, TEN, 1));
        ClassifiedTask rework = classifier.classify(Task.of("RW_3002", "Mechanic Team 1", null, 1, NINE, TEN, 1));
        ClassifiedTask neither = classifier.classify(Task.of("X_LP_3003", "Mechanic Team 1", null, 1, NINE, TEN, 1));

        assertThat(latePart.latePartTask()).isTrue();
        assertThat(rework.reworkTask()).isTrue();
        assertThat(neither.latePartTask()).isFalse();
        assertThat(latePart.requirement()).isEqualTo(RoleRequirement.TEAM);
    }

    @Test
    void classify_lowSlackMarksCritical() {
        Task base = Task.of("1001", "Mechanic Team 1", null, 1, NINE, TEN, 1);
        Task tight = new Task(base.taskId(), base.team(), null, null, "Production", null, 1, NINE, TEN,
                null, 1, null, 12.0, null, null, null, null, null);
        Task loose = new Task(base.taskId(), base.team(), null, null, "Production", null, 1, NINE, TEN,
                null, 1, null, 48.0, null, null, null, null, null);

        assertThat(classifier.classify(tight).critical()).isTrue();
        assertThat(classifier.classify(loose).critical()).isFalse();
        assertThat(classifier.classify(base).critical()).isFalse();
    }

    @Test
    void classify_parsesSkillFromTeamSkillLabel() {
        Task task = new Task("2001", "Mechanic Team 2", "Mechanic Team 2 (Avionics)", null, "Production", null,
                2, NINE, TEN, null, 1, null, null, null, null, null, null, null);

        ClassifiedTask classified = classifier.classify(task);

        assertThat(classified.team()).isEqualTo("Mechanic Team 2");
        assertThat(classified.skill()).isEqualTo("Avionics");
        assertThat(classified.teamSkillKey()).isEqualTo("Mechanic Team 2 (Avionics)");
        assertThat(classified.requiredWorkers()).isEqualTo(2);
    }

    @Test
    void classify_explicitSkillExtendsUnsuffixedTeam() {
        ClassifiedTask classified = classifier.classify(
                Task.of("2002", "Mechanic Team 2", "Hydraulics", 1, NINE, TEN, 1));

        assertThat(classified.teamSkillKey()).isEqualTo("Mechanic Team 2 (Hydraulics)");
        assertThat(classified.skill()).isEqualTo("Hydraulics");
    }

    @Test
    void classify_explicitSkillReplacesSuffixOfTeamSkillLabel() {
        Task task = new Task("2003", "Mechanic Team 2", "Mechanic Team 2 (Avionics)", "Hydraulics", "Production",
                null, 1, NINE, TEN, null, 1, null, null, null, null, null, null, null);

        ClassifiedTask classified = classifier.classify(task);

        assertThat(classified.teamSkillKey()).isEqualTo("Mechanic Team 2 (Hydraulics)");
        assertThat(classified.skill()).isEqualTo("Hydraulics");
        assertThat(classified.team()).isEqualTo("Mechanic Team 2");
    }

    @Test
    void validate_reportsMalformedTasks() {
        assertThat(classifier.validate(Task.of("1", "Mechanic Team 1", null, 1, NINE, TEN, 1))).isEmpty();
        assertThat(classifier.validate(null)).isPresent();
        assertThat(classifier.validate(Task.of(" ", "Mechanic Team 1", null, 1, NINE, TEN, 1))).isPresent();
        assertThat(classifier.validate(Task.of("2", null, null, 1, NINE, TEN, 1))).isPresent();
        assertThat(classifier.validate(Task.of("3", "Mechanic Team 1", null, 0, NINE, TEN, 1))).isPresent();
        assertThat(classifier.validate(Task.of("4", "Mechanic Team 1", null, 1, TEN, NINE, 1))).isPresent();
        assertThat(classifier.validate(Task.of("5", "Mechanic Team 1", null, 1, NINE, NINE, 1))).isPresent();
        assertThat(classifier.validate(Task.of("6", "Mechanic Team 1", null, 1, null, TEN, 1))).isPresent();
    }
}
