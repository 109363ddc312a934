package com.example.prodsched.assignment;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ManualAssignmentRequest(@NotNull(message = "workerIds is required") List<String> workerIds) {
}
