package com.hrflow.onboarding.api;

import com.hrflow.onboarding.api.dto.*;
import com.hrflow.onboarding.engine.ValidationException;
import com.hrflow.onboarding.model.WorkflowStatus;
import com.hrflow.onboarding.service.WorkflowEngine;
import com.hrflow.onboarding.service.WorkflowView;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for workflow lifecycle.
 *
 * POST /workflows                                  create from a template
 * GET  /workflows?status=                          list, newest first
 * GET  /workflows/stats                            dashboard counters
 * GET  /workflows/{id}                             full detail view
 * GET  /workflows/{id}/progress                    recomputed progress
 * POST /workflows/{id}/cancel
 * POST /workflows/{id}/steps/{stepId}/{command}    start|complete|skip|block|fail|requeue
 * POST /workflows/{id}/exceptions                  raise a manual exception
 * POST /workflows/{id}/documents                   record document metadata
 * POST /workflows/{id}/documents/{docId}/sign
 *
 * Errors are mapped by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/workflows")
public class WorkflowController {

    private final WorkflowEngine engine;

    public WorkflowController(WorkflowEngine engine) {
        this.engine = engine;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/workflows \
     *     -H "Content-Type: application/json" \
     *     -d '{"employeeId":"6f1c...","templateId":"engineering"}'
     */
    @PostMapping
    public ResponseEntity<WorkflowResponse> create(@RequestBody CreateWorkflowRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(WorkflowResponse.from(engine.createWorkflow(req.employeeId(), req.templateId())));
    }

    @GetMapping
    public List<WorkflowResponse> list(@RequestParam(required = false) String status) {
        return engine.listWorkflows(parseStatus(status)).stream()
                .map(WorkflowResponse::from)
                .toList();
    }

    @GetMapping("/stats")
    public WorkflowStatsResponse stats() {
        return WorkflowStatsResponse.from(engine.getStats());
    }

    /** The employee is looked up after the read transaction has closed. */
    @GetMapping("/{id}")
    public WorkflowDetailResponse get(@PathVariable UUID id) {
        WorkflowView view = engine.getWorkflow(id);
        return WorkflowDetailResponse.from(
                view.withEmployee(engine.findEmployee(view.workflow().getEmployeeId())));
    }

    @GetMapping("/{id}/progress")
    public ProgressResponse progress(@PathVariable UUID id) {
        return ProgressResponse.from(engine.getProgress(id));
    }

    @PostMapping("/{id}/cancel")
    public WorkflowResponse cancel(@PathVariable UUID id) {
        return WorkflowResponse.from(engine.cancelWorkflow(id));
    }

    // ------------------------------------------------------------------
    // Step commands
    // ------------------------------------------------------------------

    @PostMapping("/{id}/steps/{stepId}/start")
    public StepCommandResponse start(@PathVariable UUID id, @PathVariable UUID stepId) {
        return StepCommandResponse.from(engine.startStep(id, stepId));
    }

    @PostMapping("/{id}/steps/{stepId}/complete")
    public StepCommandResponse complete(@PathVariable UUID id, @PathVariable UUID stepId,
                                        @RequestBody(required = false) CompleteStepRequest req) {
        String completedBy = req == null ? null : req.completedBy();
        return StepCommandResponse.from(engine.completeStep(id, stepId, completedBy));
    }

    @PostMapping("/{id}/steps/{stepId}/skip")
    public StepCommandResponse skip(@PathVariable UUID id, @PathVariable UUID stepId,
                                    @RequestBody SkipStepRequest req) {
        return StepCommandResponse.from(engine.skipStep(id, stepId, req.reason(), req.skippedBy()));
    }

    @PostMapping("/{id}/steps/{stepId}/block")
    public StepCommandResponse block(@PathVariable UUID id, @PathVariable UUID stepId,
                                     @RequestBody StepIssueRequest req) {
        return StepCommandResponse.from(engine.blockStep(id, stepId, req.cause(), req.severity()));
    }

    @PostMapping("/{id}/steps/{stepId}/fail")
    public StepCommandResponse fail(@PathVariable UUID id, @PathVariable UUID stepId,
                                    @RequestBody StepIssueRequest req) {
        return StepCommandResponse.from(engine.failStep(id, stepId, req.cause(), req.severity()));
    }

    @PostMapping("/{id}/steps/{stepId}/requeue")
    public StepCommandResponse requeue(@PathVariable UUID id, @PathVariable UUID stepId) {
        return StepCommandResponse.from(engine.requeueStep(id, stepId));
    }

    // ------------------------------------------------------------------
    // Exceptions and documents
    // ------------------------------------------------------------------

    @PostMapping("/{id}/exceptions")
    public ResponseEntity<ExceptionResponse> raiseException(@PathVariable UUID id,
                                                            @RequestBody RaiseExceptionRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ExceptionResponse.from(
                engine.raiseException(id, req.stepId(), req.title(), req.description(), req.severity())));
    }

    @PostMapping("/{id}/documents")
    public ResponseEntity<DocumentResponse> recordDocument(@PathVariable UUID id,
                                                           @RequestBody RecordDocumentRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.from(
                engine.recordDocument(id, req.stepId(), req.documentName(), req.documentType(),
                        req.fileType(), req.fileSizeBytes())));
    }

    @PostMapping("/{id}/documents/{docId}/sign")
    public DocumentResponse signDocument(@PathVariable UUID id, @PathVariable UUID docId) {
        return DocumentResponse.from(engine.signDocument(id, docId));
    }

    private static WorkflowStatus parseStatus(String status) {
        if (status == null || status.isBlank()) return null;
        try {
            return WorkflowStatus.fromCode(status);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown workflow status: " + status);
        }
    }
}
