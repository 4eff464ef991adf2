package com.hrflow.onboarding.api.dto;

/** Optional request body for POST /workflows/{id}/steps/{stepId}/complete. */
public record CompleteStepRequest(String completedBy) {}
