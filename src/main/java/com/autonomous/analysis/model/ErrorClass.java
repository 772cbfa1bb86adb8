package com.autonomous.analysis.model;

public enum ErrorClass {
    CONFIGURATION,
    TRANSIENT_INFERENCE,
    PERMANENT_INFERENCE,
    DEPENDENCY_UNMET,
    AGGREGATION,
    CANCELLED
}
