package com.hrflow.onboarding.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why an exception record was raised.
 */
public enum ExceptionType {
    INTEGRATION_FAILURE("integration-failure"),   // raised by failStep
    STEP_BLOCKED("step-blocked"),                 // raised by blockStep when a severity is given
    MANUAL("manual");                             // raised by an operator

    private final String code;

    ExceptionType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }
}
