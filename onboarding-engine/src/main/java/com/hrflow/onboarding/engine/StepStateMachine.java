package com.hrflow.onboarding.engine;

import com.hrflow.onboarding.model.StepRecord;
import com.hrflow.onboarding.model.StepStatus;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * The only component allowed to change a step's status.
 *
 * Every method either applies exactly one legal transition to the step or
 * throws without touching it. Nothing here performs I/O; persistence and the
 * stage-advance side effect are the engine's job.
 *
 * <pre>
 *   PENDING ──start──▶ IN_PROGRESS ──complete──▶ COMPLETED
 *      │                    │
 *      ├──── skip ──────────┴──▶ SKIPPED      (reason required)
 *      ├──── markBlocked ───┴──▶ BLOCKED ─┐
 *      └──── markFailed ────┴──▶ FAILED  ─┴──requeue──▶ PENDING
 * </pre>
 *
 * A step cannot be completed without being started first, so every completed
 * step carries a start timestamp. Skipping does not require a start: a step
 * that does not apply should not need an artificial one.
 */
@Component
public class StepStateMachine {

    private final Clock clock;

    public StepStateMachine(Clock clock) {
        this.clock = clock;
    }

    public void start(StepRecord step) {
        require(step, step.getStatus() == StepStatus.PENDING, "start");
        step.setStatus(StepStatus.IN_PROGRESS);
        step.setStartedAt(now());
    }

    /** @param actor optional; blank is stored as null */
    public void complete(StepRecord step, String actor) {
        require(step, step.getStatus() == StepStatus.IN_PROGRESS, "complete");
        step.setStatus(StepStatus.COMPLETED);
        step.setCompletedAt(now());
        step.setCompletedBy(actorOrNull(actor));
    }

    /**
     * @throws ValidationException         if reason is null or blank, whatever the step's status
     * @throws InvalidTransitionException  if the step is not PENDING or IN_PROGRESS
     */
    public void skip(StepRecord step, String reason, String actor) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("A reason is required to skip step '" + step.getName() + "'");
        }
        require(step, step.getStatus().isOpen(), "skip");
        step.setStatus(StepStatus.SKIPPED);
        step.setSkipReason(reason.strip());
        step.setCompletedAt(now());
        step.setCompletedBy(actorOrNull(actor));
    }

    public void markBlocked(StepRecord step, String cause) {
        requireCause(step, cause);
        require(step, step.getStatus().isOpen(), "block");
        step.setStatus(StepStatus.BLOCKED);
        step.setStatusCause(cause.strip());
    }

    public void markFailed(StepRecord step, String cause) {
        requireCause(step, cause);
        require(step, step.getStatus().isOpen(), "fail");
        step.setStatus(StepStatus.FAILED);
        step.setStatusCause(cause.strip());
    }

    /** BLOCKED | FAILED → PENDING once the underlying problem is fixed. */
    public void requeue(StepRecord step) {
        StepStatus status = step.getStatus();
        require(step, status == StepStatus.BLOCKED || status == StepStatus.FAILED, "requeue");
        step.setStatus(StepStatus.PENDING);
        step.setStartedAt(null);
        step.setStatusCause(null);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Instant now() {
        return clock.instant();
    }

    private static String actorOrNull(String actor) {
        return actor == null || actor.isBlank() ? null : actor.strip();
    }

    private static void require(StepRecord step, boolean allowed, String action) {
        if (!allowed) {
            throw new InvalidTransitionException("Cannot %s step '%s' in status %s"
                    .formatted(action, step.getName(), step.getStatus().code()));
        }
    }

    private static void requireCause(StepRecord step, String cause) {
        if (cause == null || cause.isBlank()) {
            throw new ValidationException("A cause is required to block or fail step '" + step.getName() + "'");
        }
    }
}
