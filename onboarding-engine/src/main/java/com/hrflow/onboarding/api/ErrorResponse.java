package com.hrflow.onboarding.api;

import com.hrflow.onboarding.engine.ErrorCode;

import java.time.Instant;

/** Body of every non-2xx response. */
public record ErrorResponse(
        ErrorCode code,
        String    message,
        int       status,
        Instant   timestamp,
        String    path
) {}
