package com.hrflow.onboarding.engine;

/**
 * Storage failed while applying a command. The transaction has been rolled
 * back, so the caller should re-issue the whole command.
 */
public class WorkflowPersistenceException extends OnboardingException {
    public WorkflowPersistenceException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_ERROR, message, cause);
    }
}
