package com.hrflow.onboarding.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * The four ordered phases of onboarding.
 *
 * Declaration order is the execution order:
 *   PRE_BOARDING → DAY_1 → WEEK_1 → MONTH_1
 *
 * A workflow's current stage only ever moves forward along this order.
 */
public enum Stage {
    PRE_BOARDING("pre-boarding"),
    DAY_1("day-1"),
    WEEK_1("week-1"),
    MONTH_1("month-1");

    private final String code;

    Stage(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }

    public boolean isAfter(Stage other) {
        return ordinal() > other.ordinal();
    }

    @JsonCreator
    public static Stage fromCode(String code) {
        return Arrays.stream(values())
                .filter(s -> s.code.equalsIgnoreCase(code) || s.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown stage: " + code));
    }
}
