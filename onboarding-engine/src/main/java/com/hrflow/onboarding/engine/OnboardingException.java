package com.hrflow.onboarding.engine;

/**
 * Base type for every rule violation the engine reports to callers.
 *
 * Unchecked: the state machine and calculator throw these straight through,
 * and only the API layer catches them to map {@link #getCode()} onto a
 * response.
 */
public abstract class OnboardingException extends RuntimeException {

    private final ErrorCode code;

    protected OnboardingException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected OnboardingException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() { return code; }

    /** True when re-issuing the same command may succeed. */
    public boolean isRetryable() {
        return code == ErrorCode.PERSISTENCE_ERROR;
    }
}
