package com.hrflow.onboarding.engine;

/**
 * Thrown when a command asks for a status change its lifecycle does not allow,
 * e.g. completing a step that was never started or resolving an exception twice.
 */
public class InvalidTransitionException extends OnboardingException {
    public InvalidTransitionException(String message) {
        super(ErrorCode.INVALID_TRANSITION, message);
    }
}
