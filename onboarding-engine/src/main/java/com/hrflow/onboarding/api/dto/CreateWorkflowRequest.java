package com.hrflow.onboarding.api.dto;

import java.util.UUID;

/**
 * Request body for POST /workflows.
 *
 * templateId defaults to "standard" when omitted.
 */
public record CreateWorkflowRequest(UUID employeeId, String templateId) {

    public CreateWorkflowRequest {
        if (templateId == null || templateId.isBlank()) templateId = "standard";
    }
}
