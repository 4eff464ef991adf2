package com.hrflow.onboarding.engine;

/**
 * Stable error codes returned to callers. The names are part of the API.
 */
public enum ErrorCode {
    VALIDATION_ERROR,     // malformed or missing input, e.g. blank skip reason
    INVALID_TRANSITION,   // a lifecycle rule was violated
    NOT_FOUND,            // unknown workflow, step, exception or document id
    DUPLICATE_WORKFLOW,   // employee already has an active workflow
    TEMPLATE_NOT_FOUND,   // unknown template id
    PERSISTENCE_ERROR     // storage failed; safe to retry the whole command
}
