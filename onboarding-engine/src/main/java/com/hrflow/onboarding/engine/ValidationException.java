package com.hrflow.onboarding.engine;

public class ValidationException extends OnboardingException {
    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
