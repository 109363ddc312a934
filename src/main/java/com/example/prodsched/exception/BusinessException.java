package com.example.prodsched.exception;

public class BusinessException extends RuntimeException {

    public static final String SCENARIO_NOT_FOUND = "SCENARIO_NOT_FOUND";
    public static final String SNAPSHOT_NOT_FOUND = "SNAPSHOT_NOT_FOUND";
    public static final String TASK_NOT_FOUND = "TASK_NOT_FOUND";
    public static final String SNAPSHOT_UNREADABLE = "SNAPSHOT_UNREADABLE";

    private final String errorCode;

    public BusinessException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public static BusinessException scenarioNotFound(String scenarioId) {
        return new BusinessException(SCENARIO_NOT_FOUND, "Scenario not found: " + scenarioId);
    }

    public static BusinessException taskNotFound(String scenarioId, String taskId) {
        return new BusinessException(TASK_NOT_FOUND,
                "Task " + taskId + " not found in scenario " + scenarioId);
    }

    public boolean isNotFound() {
        return errorCode.endsWith("_NOT_FOUND");
    }

    public String getErrorCode() {
        return errorCode;
    }
}
