package com.hrflow.onboarding.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * OPEN → RESOLVED, once, by an explicit actor. There is no way back.
 */
public enum ResolutionStatus {
    OPEN("open"),
    RESOLVED("resolved");

    private final String code;

    ResolutionStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }
}
