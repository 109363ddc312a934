package com.example.prodsched.assignment;

public record TeamStatistics(String team, int capacity, int tasksAssigned, int partial, int conflicts,
                             double successRate) {
}
