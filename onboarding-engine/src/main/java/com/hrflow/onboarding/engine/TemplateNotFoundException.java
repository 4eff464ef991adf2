package com.hrflow.onboarding.engine;

public class TemplateNotFoundException extends OnboardingException {
    public TemplateNotFoundException(String templateId) {
        super(ErrorCode.TEMPLATE_NOT_FOUND, "No onboarding template registered with id: '" + templateId + "'");
    }
}
