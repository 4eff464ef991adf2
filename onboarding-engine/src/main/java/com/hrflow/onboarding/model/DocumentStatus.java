package com.hrflow.onboarding.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * GENERATED → SIGNED is the only transition a document ever makes.
 */
public enum DocumentStatus {
    GENERATED("generated"),
    SIGNED("signed");

    private final String code;

    DocumentStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }
}
