package com.hrflow.onboarding.api.dto;

import com.hrflow.onboarding.model.Severity;

/**
 * Request body for the block and fail step commands.
 *
 * severity is optional: for block it decides whether an exception is raised,
 * for fail it overrides the default HIGH.
 */
public record StepIssueRequest(String cause, Severity severity) {}
