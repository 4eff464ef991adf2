package com.hrflow.onboarding.api.dto;

/** Request body for POST /exceptions/{id}/resolve. */
public record ResolveExceptionRequest(String resolvedBy, String note) {}
