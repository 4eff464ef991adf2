package com.hrflow.onboarding.engine;

import com.hrflow.onboarding.model.Stage;
import com.hrflow.onboarding.model.StepRecord;
import com.hrflow.onboarding.model.StepStatus;
import com.hrflow.onboarding.model.WorkflowInstance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;

import static com.hrflow.onboarding.support.WorkflowFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepStateMachineTest {

    static final Instant NOW = START.plusSeconds(3600);

    StepStateMachine machine;
    WorkflowInstance workflow;

    @BeforeEach
    void setUp() {
        machine  = new StepStateMachine(clockAt(NOW));
        workflow = workflow(30);
    }

    // ------------------------------------------------------------------
    // start / complete
    // ------------------------------------------------------------------

    @Test
    void start_pending_movesToInProgressAndStampsStart() {
        StepRecord step = addStep(workflow, Stage.PRE_BOARDING, "Send Offer Letter");

        machine.start(step);

        assertThat(step.getStatus()).isEqualTo(StepStatus.IN_PROGRESS);
        assertThat(step.getStartedAt()).isEqualTo(NOW);
    }

    @ParameterizedTest
    @EnumSource(value = StepStatus.class, names = "PENDING", mode = EnumSource.Mode.EXCLUDE)
    void start_notPending_rejectedWithoutChange(StepStatus status) {
        StepRecord step = addStep(workflow, Stage.PRE_BOARDING, "Send Offer Letter", status);

        assertThatThrownBy(() -> machine.start(step))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessageContaining("Send Offer Letter");
        assertThat(step.getStatus()).isEqualTo(status);
    }

    @Test
    void complete_inProgress_movesToCompleted() {
        StepRecord step = addStep(workflow, Stage.PRE_BOARDING, "Send Offer Letter");
        machine.start(step);

        machine.complete(step, " hr-admin ");

        assertThat(step.getStatus()).isEqualTo(StepStatus.COMPLETED);
        assertThat(step.getCompletedAt()).isEqualTo(NOW);
        assertThat(step.getStartedAt()).isNotNull();
        assertThat(step.getCompletedBy()).isEqualTo("hr-admin");
    }

    @Test
    void complete_blankActor_storedAsNull() {
        StepRecord step = addStep(workflow, Stage.PRE_BOARDING, "Send Offer Letter", StepStatus.IN_PROGRESS);

        machine.complete(step, "  ");

        assertThat(step.getStatus()).isEqualTo(StepStatus.COMPLETED);
        assertThat(step.getCompletedBy()).isNull();
    }

    @Test
    void complete_pending_rejected() {
        // A step has to be started before it can be completed.
        StepRecord step = addStep(workflow, Stage.PRE_BOARDING, "Send Offer Letter");

        assertThatThrownBy(() -> machine.complete(step, "hr-admin"))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(step.getStatus()).isEqualTo(StepStatus.PENDING);
        assertThat(step.getCompletedAt()).isNull();
        assertThat(step.getCompletedBy()).isNull();
    }

    // ------------------------------------------------------------------
    // skip
    // ------------------------------------------------------------------

    @Test
    void skip_pending_allowedWithoutStart() {
        StepRecord step = addStep(workflow, Stage.DAY_1, "Office Tour");

        machine.skip(step, "  remote hire  ", null);

        assertThat(step.getStatus()).isEqualTo(StepStatus.SKIPPED);
        assertThat(step.getSkipReason()).isEqualTo("remote hire");
        assertThat(step.getStartedAt()).isNull();
        assertThat(step.getCompletedAt()).isEqualTo(NOW);
    }

    @Test
    void skip_afterStart_recordsReason() {
        StepRecord step = addStep(workflow, Stage.DAY_1, "Office Tour");
        machine.start(step);

        machine.skip(step, "office closed", "manager-42");

        assertThat(step.getStatus()).isEqualTo(StepStatus.SKIPPED);
        assertThat(step.getSkipReason()).isEqualTo("office closed");
        assertThat(step.getCompletedBy()).isEqualTo("manager-42");
    }

    @Test
    void skip_blankReason_isValidationErrorEvenWhenAlreadyCompleted() {
        StepRecord step = addStep(workflow, Stage.DAY_1, "Office Tour", StepStatus.COMPLETED);

        assertThatThrownBy(() -> machine.skip(step, " ", "hr-admin"))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((OnboardingException) e).getCode())
                .isEqualTo(ErrorCode.VALIDATION_ERROR);
    }

    @Test
    void skip_completed_rejected() {
        StepRecord step = addStep(workflow, Stage.DAY_1, "Office Tour", StepStatus.COMPLETED);

        assertThatThrownBy(() -> machine.skip(step, "too late", null))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(step.getSkipReason()).isNull();
    }

    // ------------------------------------------------------------------
    // block / fail / requeue
    // ------------------------------------------------------------------

    @Test
    void markFailed_inProgress_recordsCause() {
        StepRecord step = addStep(workflow, Stage.PRE_BOARDING, "Send I-9 Form", StepStatus.IN_PROGRESS);

        machine.markFailed(step, "docusign returned 502");

        assertThat(step.getStatus()).isEqualTo(StepStatus.FAILED);
        assertThat(step.getStatusCause()).isEqualTo("docusign returned 502");
    }

    @Test
    void markBlocked_missingCause_rejected() {
        StepRecord step = addStep(workflow, Stage.PRE_BOARDING, "Send I-9 Form");

        assertThatThrownBy(() -> machine.markBlocked(step, null))
                .isInstanceOf(ValidationException.class);
        assertThat(step.getStatus()).isEqualTo(StepStatus.PENDING);
    }

    @Test
    void requeue_failed_returnsToPendingAndClearsCause() {
        StepRecord step = addStep(workflow, Stage.PRE_BOARDING, "Send I-9 Form", StepStatus.IN_PROGRESS);
        machine.markFailed(step, "timeout");

        machine.requeue(step);

        assertThat(step.getStatus()).isEqualTo(StepStatus.PENDING);
        assertThat(step.getStartedAt()).isNull();
        assertThat(step.getStatusCause()).isNull();
    }

    @Test
    void requeue_pending_rejected() {
        StepRecord step = addStep(workflow, Stage.PRE_BOARDING, "Send I-9 Form");

        assertThatThrownBy(() -> machine.requeue(step))
                .isInstanceOf(InvalidTransitionException.class);
    }
}
