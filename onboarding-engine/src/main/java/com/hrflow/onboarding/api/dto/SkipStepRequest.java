package com.hrflow.onboarding.api.dto;

/** Request body for POST /workflows/{id}/steps/{stepId}/skip. skippedBy is optional. */
public record SkipStepRequest(String reason, String skippedBy) {}
