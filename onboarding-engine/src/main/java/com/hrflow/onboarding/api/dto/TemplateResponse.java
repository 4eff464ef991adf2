package com.hrflow.onboarding.api.dto;

import com.hrflow.onboarding.template.TemplateProperties.TemplateDefinition;

/** One entry of GET /templates: what a client may pass as templateId. */
public record TemplateResponse(
        String id,
        String displayName,
        int    expectedDays,
        int    stepCount
) {
    public static TemplateResponse from(String id, TemplateDefinition t) {
        return new TemplateResponse(id, t.displayName(), t.expectedDays(), t.steps().size());
    }
}
