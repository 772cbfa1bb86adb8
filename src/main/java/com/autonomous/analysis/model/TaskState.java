package com.autonomous.analysis.model;

public enum TaskState {
    WAITING,
    READY,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }

    public boolean isUnsuccessfulEnd() {
        return this == FAILED || this == SKIPPED;
    }
}
