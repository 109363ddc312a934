package com.example.prodsched.schedule;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

public record AggregatedTask(@JsonUnwrapped ScheduledTask task, String assignedTo, String assignedToName) {
}
