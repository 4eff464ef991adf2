package com.hrflow.onboarding.api;

import com.hrflow.onboarding.employee.EmployeeSummary;
import com.hrflow.onboarding.engine.*;
import com.hrflow.onboarding.model.*;
import com.hrflow.onboarding.service.CommandOutcome;
import com.hrflow.onboarding.service.StepCommandResult;
import com.hrflow.onboarding.service.WorkflowEngine;
import com.hrflow.onboarding.service.WorkflowStats;
import com.hrflow.onboarding.service.WorkflowView;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.hrflow.onboarding.support.WorkflowFixtures.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for WorkflowController and the error mapping in ApiExceptionHandler.
 *
 * @WebMvcTest spins up only the web layer (no DB, no templates, no directory).
 */
@WebMvcTest(WorkflowController.class)
class WorkflowControllerTest {

    @Autowired MockMvc         mockMvc;
    @MockitoBean WorkflowEngine engine;

    // ------------------------------------------------------------------
    // POST /workflows
    // ------------------------------------------------------------------

    @Test
    void create_validRequest_returns201() throws Exception {
        WorkflowInstance workflow = workflow(30);
        addStep(workflow, Stage.PRE_BOARDING, "Send Offer Letter");
        when(engine.createWorkflow(workflow.getEmployeeId(), "engineering")).thenReturn(workflow);

        mockMvc.perform(post("/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"employeeId":"%s","templateId":"engineering"}
                                """.formatted(workflow.getEmployeeId())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(workflow.getId().toString()))
                .andExpect(jsonPath("$.status").value("active"))
                .andExpect(jsonPath("$.currentStage").value("pre-boarding"))
                .andExpect(jsonPath("$.expectedDays").value(30));
    }

    @Test
    void create_templateOmitted_defaultsToStandard() throws Exception {
        WorkflowInstance workflow = workflow(30);
        when(engine.createWorkflow(workflow.getEmployeeId(), "standard")).thenReturn(workflow);

        mockMvc.perform(post("/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employeeId\":\"%s\"}".formatted(workflow.getEmployeeId())))
                .andExpect(status().isCreated());
    }

    @Test
    void create_duplicate_returns409() throws Exception {
        UUID employeeId = UUID.randomUUID();
        when(engine.createWorkflow(any(), any())).thenThrow(new DuplicateWorkflowException(employeeId));

        mockMvc.perform(post("/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employeeId\":\"%s\"}".formatted(employeeId)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("DUPLICATE_WORKFLOW"))
                .andExpect(jsonPath("$.status").value(409))
                .andExpect(jsonPath("$.path").value("/workflows"));
    }

    @Test
    void create_unknownTemplate_returns404() throws Exception {
        when(engine.createWorkflow(any(), any())).thenThrow(new TemplateNotFoundException("sales"));

        mockMvc.perform(post("/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employeeId\":\"%s\",\"templateId\":\"sales\"}".formatted(UUID.randomUUID())))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("TEMPLATE_NOT_FOUND"));
    }

    @Test
    void create_malformedBody_returns400() throws Exception {
        mockMvc.perform(post("/workflows")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
        verifyNoInteractions(engine);
    }

    // ------------------------------------------------------------------
    // GET /workflows, /workflows/{id}, /workflows/{id}/progress
    // ------------------------------------------------------------------

    @Test
    void list_byStatusCode_passesParsedStatus() throws Exception {
        WorkflowInstance workflow = workflow(30);
        workflow.setStatus(WorkflowStatus.COMPLETED);
        when(engine.listWorkflows(WorkflowStatus.COMPLETED)).thenReturn(List.of(workflow));

        mockMvc.perform(get("/workflows").param("status", "completed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("completed"));
    }

    @Test
    void list_unknownStatus_returns400() throws Exception {
        mockMvc.perform(get("/workflows").param("status", "paused"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
        verifyNoInteractions(engine);
    }

    @Test
    void stats_returnsDashboardCounters() throws Exception {
        when(engine.getStats()).thenReturn(new WorkflowStats(2, 7, 3, 18));

        mockMvc.perform(get("/workflows/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.templateCount").value(2))
                .andExpect(jsonPath("$.activeWorkflows").value(7))
                .andExpect(jsonPath("$.completedThisMonth").value(3))
                .andExpect(jsonPath("$.averageCompletionDays").value(18));
    }

    @Test
    void get_returnsDetailGroupedByStage() throws Exception {
        WorkflowInstance workflow = workflow(30);
        StepRecord offer = addStep(workflow, Stage.PRE_BOARDING, "Send Offer Letter", StepStatus.COMPLETED);
        StepRecord tour  = addStep(workflow, Stage.DAY_1, "Office Tour");
        List<StepRecord> steps = List.of(offer, tour);
        WorkflowView view = new WorkflowView(workflow, steps,
                Map.of(Stage.PRE_BOARDING, List.of(offer), Stage.DAY_1, List.of(tour)),
                List.of(), List.of(), snapshot(workflow, 50), null);
        when(engine.getWorkflow(workflow.getId())).thenReturn(view);
        when(engine.findEmployee(workflow.getEmployeeId())).thenReturn(null);

        mockMvc.perform(get("/workflows/{id}", workflow.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.workflow.employeeId").value(workflow.getEmployeeId().toString()))
                .andExpect(jsonPath("$.employee").doesNotExist())
                .andExpect(jsonPath("$.steps[0].status").value("completed"))
                .andExpect(jsonPath("$.stepsByStage['day-1'][0]").value(tour.getId().toString()))
                .andExpect(jsonPath("$.progress.progressPercentage").value(50));
    }

    @Test
    void get_attachesEmployeeLookedUpAfterTheRead() throws Exception {
        WorkflowInstance workflow = workflow(30);
        WorkflowView view = new WorkflowView(workflow, List.of(), Map.of(), List.of(), List.of(),
                snapshot(workflow, 0), null);
        EmployeeSummary employee = new EmployeeSummary(workflow.getEmployeeId(), "Ada", "Lovelace",
                "ada@example.com", "Engineering", "Backend Engineer", START);
        when(engine.getWorkflow(workflow.getId())).thenReturn(view);
        when(engine.findEmployee(workflow.getEmployeeId())).thenReturn(employee);

        mockMvc.perform(get("/workflows/{id}", workflow.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.employee.first_name").value("Ada"))
                .andExpect(jsonPath("$.employee.department").value("Engineering"));
    }

    @Test
    void get_unknownWorkflow_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(engine.getWorkflow(id)).thenThrow(new NotFoundException("Workflow", id));

        mockMvc.perform(get("/workflows/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("Workflow not found: " + id));
    }

    @Test
    void get_malformedId_returns400() throws Exception {
        mockMvc.perform(get("/workflows/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void progress_returnsSnapshot() throws Exception {
        WorkflowInstance workflow = workflow(30);
        when(engine.getProgress(workflow.getId())).thenReturn(snapshot(workflow, 75));

        mockMvc.perform(get("/workflows/{id}/progress", workflow.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.progressPercentage").value(75))
                .andExpect(jsonPath("$.onTrack").value(true))
                .andExpect(jsonPath("$.currentStage").value("pre-boarding"));
    }

    // ------------------------------------------------------------------
    // Step commands
    // ------------------------------------------------------------------

    @Test
    void start_applied_returnsOutcomeStepAndProgress() throws Exception {
        WorkflowInstance workflow = workflow(30);
        StepRecord step = addStep(workflow, Stage.PRE_BOARDING, "Send Offer Letter", StepStatus.IN_PROGRESS);
        when(engine.startStep(workflow.getId(), step.getId()))
                .thenReturn(new StepCommandResult(step, CommandOutcome.APPLIED, snapshot(workflow, 0)));

        mockMvc.perform(post("/workflows/{id}/steps/{stepId}/start", workflow.getId(), step.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("applied"))
                .andExpect(jsonPath("$.step.status").value("in-progress"))
                .andExpect(jsonPath("$.progress.totalSteps").value(1));
    }

    @Test
    void complete_withoutBody_passesNullActor() throws Exception {
        WorkflowInstance workflow = workflow(30);
        StepRecord step = addStep(workflow, Stage.PRE_BOARDING, "Send Offer Letter", StepStatus.COMPLETED);
        when(engine.completeStep(eq(workflow.getId()), eq(step.getId()), isNull()))
                .thenReturn(new StepCommandResult(step, CommandOutcome.ALREADY_APPLIED, snapshot(workflow, 100)));

        mockMvc.perform(post("/workflows/{id}/steps/{stepId}/complete", workflow.getId(), step.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("already-applied"));
    }

    @Test
    void complete_withActor_returnsCompletedBy() throws Exception {
        WorkflowInstance workflow = workflow(30);
        StepRecord step = addStep(workflow, Stage.PRE_BOARDING, "Send Offer Letter", StepStatus.COMPLETED);
        step.setCompletedBy("hr-admin");
        when(engine.completeStep(workflow.getId(), step.getId(), "hr-admin"))
                .thenReturn(new StepCommandResult(step, CommandOutcome.APPLIED, snapshot(workflow, 100)));

        mockMvc.perform(post("/workflows/{id}/steps/{stepId}/complete", workflow.getId(), step.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"completedBy\":\"hr-admin\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("applied"))
                .andExpect(jsonPath("$.step.completedBy").value("hr-admin"));
    }

    @Test
    void complete_invalidTransition_returns409() throws Exception {
        when(engine.completeStep(any(), any(), any()))
                .thenThrow(new InvalidTransitionException("Cannot complete step 'Office Tour' in status pending"));

        mockMvc.perform(post("/workflows/{id}/steps/{stepId}/complete", UUID.randomUUID(), UUID.randomUUID()))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"));
    }

    @Test
    void skip_passesReasonAndActor() throws Exception {
        WorkflowInstance workflow = workflow(30);
        StepRecord step = addStep(workflow, Stage.DAY_1, "Office Tour", StepStatus.SKIPPED);
        when(engine.skipStep(workflow.getId(), step.getId(), "remote hire", "manager-42"))
                .thenReturn(new StepCommandResult(step, CommandOutcome.APPLIED, snapshot(workflow, 100)));

        mockMvc.perform(post("/workflows/{id}/steps/{stepId}/skip", workflow.getId(), step.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"remote hire\",\"skippedBy\":\"manager-42\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.step.skipReason").value("not applicable"));
    }

    @Test
    void fail_parsesSeverityCode() throws Exception {
        WorkflowInstance workflow = workflow(30);
        StepRecord step = addStep(workflow, Stage.PRE_BOARDING, "Send I-9 Form", StepStatus.FAILED);
        when(engine.failStep(workflow.getId(), step.getId(), "502 from docusign", Severity.CRITICAL))
                .thenReturn(new StepCommandResult(step, CommandOutcome.APPLIED, snapshot(workflow, 0)));

        mockMvc.perform(post("/workflows/{id}/steps/{stepId}/fail", workflow.getId(), step.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cause\":\"502 from docusign\",\"severity\":\"critical\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.step.status").value("failed"));
    }

    @Test
    void block_withoutSeverity_passesNull() throws Exception {
        WorkflowInstance workflow = workflow(30);
        StepRecord step = addStep(workflow, Stage.PRE_BOARDING, "Send I-9 Form", StepStatus.BLOCKED);
        when(engine.blockStep(eq(workflow.getId()), eq(step.getId()), eq("waiting on employee"), isNull()))
                .thenReturn(new StepCommandResult(step, CommandOutcome.APPLIED, snapshot(workflow, 0)));

        mockMvc.perform(post("/workflows/{id}/steps/{stepId}/block", workflow.getId(), step.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cause\":\"waiting on employee\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.step.status").value("blocked"));
    }

    @Test
    void requeue_persistenceFailure_returns503() throws Exception {
        when(engine.requeueStep(any(), any()))
                .thenThrow(new WorkflowPersistenceException("Could not requeue", new RuntimeException("db down")));

        mockMvc.perform(post("/workflows/{id}/steps/{stepId}/requeue", UUID.randomUUID(), UUID.randomUUID()))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("PERSISTENCE_ERROR"));
    }

    @Test
    void progress_connectionUnavailableAtTransactionBegin_returns503() throws Exception {
        UUID id = UUID.randomUUID();
        when(engine.getProgress(id)).thenThrow(new CannotCreateTransactionException("Could not open JPA EntityManager"));

        mockMvc.perform(get("/workflows/{id}/progress", id))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("PERSISTENCE_ERROR"))
                .andExpect(jsonPath("$.status").value(503));
    }

    // ------------------------------------------------------------------
    // Exceptions, documents, cancel
    // ------------------------------------------------------------------

    @Test
    void raiseException_returns201() throws Exception {
        WorkflowInstance workflow = workflow(30);
        ExceptionRecord exception = new ExceptionRecord(workflow, null, ExceptionType.MANUAL,
                "Missing SSN", null, Severity.HIGH, START);
        setId(exception, UUID.randomUUID());
        when(engine.raiseException(workflow.getId(), null, "Missing SSN", null, Severity.HIGH)).thenReturn(exception);

        mockMvc.perform(post("/workflows/{id}/exceptions", workflow.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Missing SSN\",\"severity\":\"high\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.workflowId").value(workflow.getId().toString()))
                .andExpect(jsonPath("$.resolutionStatus").value("open"))
                .andExpect(jsonPath("$.severity").value("high"));
    }

    @Test
    void raiseException_unknownSeverity_returns400() throws Exception {
        mockMvc.perform(post("/workflows/{id}/exceptions", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Missing SSN\",\"severity\":\"urgent\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void recordDocument_returns201() throws Exception {
        WorkflowInstance workflow = workflow(30);
        DocumentRecord document = new DocumentRecord(workflow, null, "I-9.pdf", "i9", "pdf", 2048, START);
        when(engine.recordDocument(workflow.getId(), null, "I-9.pdf", "i9", "pdf", 2048)).thenReturn(document);

        mockMvc.perform(post("/workflows/{id}/documents", workflow.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"documentName":"I-9.pdf","documentType":"i9","fileType":"pdf","fileSizeBytes":2048}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("generated"))
                .andExpect(jsonPath("$.fileSizeBytes").value(2048));
    }

    @Test
    void signDocument_returnsSigned() throws Exception {
        WorkflowInstance workflow = workflow(30);
        DocumentRecord document = new DocumentRecord(workflow, null, "I-9.pdf", "i9", "pdf", 2048, START);
        setId(document, UUID.randomUUID());
        document.markSigned(START);
        when(engine.signDocument(workflow.getId(), document.getId())).thenReturn(document);

        mockMvc.perform(post("/workflows/{id}/documents/{docId}/sign", workflow.getId(), document.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("signed"));
    }

    @Test
    void cancel_returnsCancelledWorkflow() throws Exception {
        WorkflowInstance workflow = workflow(30);
        workflow.setStatus(WorkflowStatus.CANCELLED);
        when(engine.cancelWorkflow(workflow.getId())).thenReturn(workflow);

        mockMvc.perform(post("/workflows/{id}/cancel", workflow.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("cancelled"));
        verify(engine).cancelWorkflow(workflow.getId());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ProgressSnapshot snapshot(WorkflowInstance workflow, int percentage) {
        int total = workflow.getSteps().size();
        return new ProgressSnapshot(workflow.getId(), workflow.getStatus(), workflow.getCurrentStage(),
                total, 0, 0, 0, total, 0, 0, percentage, 1, workflow.getExpectedDays(), true, 0, List.of());
    }
}
