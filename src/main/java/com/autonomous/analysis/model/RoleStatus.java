package com.autonomous.analysis.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RoleStatus {
    String role;
    TaskState state;
    int attempts;
    ErrorClass lastErrorClass;
    String lastError;
}
