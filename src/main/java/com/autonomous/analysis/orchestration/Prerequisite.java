package com.autonomous.analysis.orchestration;

public record Prerequisite(String role, boolean optional) {

    public static Prerequisite mandatory(String role) {
        return new Prerequisite(role, false);
    }

    public static Prerequisite optional(String role) {
        return new Prerequisite(role, true);
    }
}
