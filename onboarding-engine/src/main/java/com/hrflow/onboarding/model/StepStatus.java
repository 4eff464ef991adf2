package com.hrflow.onboarding.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Lifecycle of a single onboarding step.
 *
 * Transitions:
 *   PENDING     → IN_PROGRESS (start)
 *   IN_PROGRESS → COMPLETED   (complete)
 *   PENDING | IN_PROGRESS → SKIPPED (skip, reason required)
 *   PENDING | IN_PROGRESS → BLOCKED (system-detected)
 *   PENDING | IN_PROGRESS → FAILED  (integration action errored)
 *   BLOCKED | FAILED      → PENDING (re-queued after remediation)
 *
 * COMPLETED and SKIPPED are terminal.
 */
public enum StepStatus {
    PENDING("pending"),
    IN_PROGRESS("in-progress"),
    COMPLETED("completed"),
    SKIPPED("skipped"),
    BLOCKED("blocked"),
    FAILED("failed");

    private final String code;

    StepStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }

    /** Completed or skipped: counts towards progress and stage completion. */
    public boolean isDone() {
        return this == COMPLETED || this == SKIPPED;
    }

    /** Statuses from which skip, markBlocked and markFailed are allowed. */
    public boolean isOpen() {
        return this == PENDING || this == IN_PROGRESS;
    }

    @JsonCreator
    public static StepStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(s -> s.code.equalsIgnoreCase(code) || s.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown step status: " + code));
    }
}
