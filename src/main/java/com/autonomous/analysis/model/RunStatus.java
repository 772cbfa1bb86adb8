package com.autonomous.analysis.model;

public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    FAILED,
    CANCELLED;

    public boolean isFinished() {
        return this != PENDING && this != RUNNING;
    }
}
