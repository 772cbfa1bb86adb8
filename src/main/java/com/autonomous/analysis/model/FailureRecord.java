package com.autonomous.analysis.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class FailureRecord {
    String role;
    int attempt;
    ErrorClass errorClass;
    String message;
    Instant timestamp;
}
