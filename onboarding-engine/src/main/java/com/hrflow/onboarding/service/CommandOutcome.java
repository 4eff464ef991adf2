package com.hrflow.onboarding.service;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a step command did.
 *
 * ALREADY_APPLIED is returned instead of an error when a command is retried
 * after it already took effect (e.g. completing a completed step). Nothing is
 * written and no side effect is repeated in that case.
 */
public enum CommandOutcome {
    APPLIED("applied"),
    ALREADY_APPLIED("already-applied");

    private final String code;

    CommandOutcome(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }
}
