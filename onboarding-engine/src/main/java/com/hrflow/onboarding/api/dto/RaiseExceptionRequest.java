package com.hrflow.onboarding.api.dto;

import com.hrflow.onboarding.model.Severity;

import java.util.UUID;

/** Request body for POST /workflows/{id}/exceptions. stepId is optional. */
public record RaiseExceptionRequest(UUID stepId, String title, String description, Severity severity) {}
