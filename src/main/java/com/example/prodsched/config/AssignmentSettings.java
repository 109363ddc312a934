package com.example.prodsched.config;

import com.example.prodsched.assignment.TaskOrdering;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class AssignmentSettings {
    private final String customerMarker;
    private final String qualityMarker;
    private final String latePartPrefix;
    private final String reworkPrefix;
    private final List<String> customerTypes;
    private final String qualityType;
    private final String latePartType;
    private final String reworkType;
    private final double criticalSlackHours;
    private final TaskOrdering defaultOrdering;
    private final boolean clearRecordOnConflict;

    public AssignmentSettings(
            @Value("${prodsched.task.customer-marker:CC_}") String customerMarker,
            @Value("${prodsched.task.quality-marker:QI_}") String qualityMarker,
            @Value("${prodsched.task.late-part-prefix:LP_}") String latePartPrefix,
            @Value("${prodsched.task.rework-prefix:RW_}") String reworkPrefix,
            @Value("${prodsched.task.customer-types:Customer,Customer Inspection}") List<String> customerTypes,
            @Value("${prodsched.task.quality-type:Quality Inspection}") String qualityType,
            @Value("${prodsched.task.late-part-type:Late Part}") String latePartType,
            @Value("${prodsched.task.rework-type:Rework}") String reworkType,
            @Value("${prodsched.task.critical-slack-hours:24}") double criticalSlackHours,
            @Value("${prodsched.assignment.default-ordering:PRIORITY_THEN_START}") TaskOrdering defaultOrdering,
            @Value("${prodsched.assignment.clear-record-on-conflict:false}") boolean clearRecordOnConflict) {
        this.customerMarker = customerMarker;
        this.qualityMarker = qualityMarker;
        this.latePartPrefix = latePartPrefix;
        this.reworkPrefix = reworkPrefix;
        this.customerTypes = List.copyOf(customerTypes);
        this.qualityType = qualityType;
        this.latePartType = latePartType;
        this.reworkType = reworkType;
        this.criticalSlackHours = criticalSlackHours;
        this.defaultOrdering = defaultOrdering;
        this.clearRecordOnConflict = clearRecordOnConflict;
    }

    /** Settings with the shipped defaults, for use outside a Spring context. */
    public static AssignmentSettings defaults() {
        return new AssignmentSettings("CC_", "QI_", "LP_", "RW_",
                List.of("Customer", "Customer Inspection"), "Quality Inspection", "Late Part", "Rework",
                24, TaskOrdering.PRIORITY_THEN_START, false);
    }

    public String getCustomerMarker() { return customerMarker; }
    public String getQualityMarker() { return qualityMarker; }
    public String getLatePartPrefix() { return latePartPrefix; }
    public String getReworkPrefix() { return reworkPrefix; }
    public List<String> getCustomerTypes() { return customerTypes; }
    public String getQualityType() { return qualityType; }
    public String getLatePartType() { return latePartType; }
    public String getReworkType() { return reworkType; }
    public double getCriticalSlackHours() { return criticalSlackHours; }
    public TaskOrdering getDefaultOrdering() { return defaultOrdering; }
    public boolean isClearRecordOnConflict() { return clearRecordOnConflict; }
}
