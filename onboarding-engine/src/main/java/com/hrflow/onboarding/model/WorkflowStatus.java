package com.hrflow.onboarding.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Overall state of a workflow instance.
 *
 *   ACTIVE → COMPLETED  (last stage holding steps is complete)
 *   ACTIVE → CANCELLED  (operator cancelled the onboarding)
 *
 * An employee can have at most one ACTIVE workflow.
 */
public enum WorkflowStatus {
    ACTIVE("active"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    private final String code;

    WorkflowStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }

    @JsonCreator
    public static WorkflowStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(s -> s.code.equalsIgnoreCase(code) || s.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown workflow status: " + code));
    }
}
