package com.hrflow.onboarding.engine;

import java.util.UUID;

public class NotFoundException extends OnboardingException {

    public NotFoundException(String kind, UUID id) {
        super(ErrorCode.NOT_FOUND, kind + " not found: " + id);
    }
}
