package com.hrflow.onboarding.service;

import com.hrflow.onboarding.employee.EmployeeDirectory;
import com.hrflow.onboarding.employee.EmployeeDirectoryException;
import com.hrflow.onboarding.employee.EmployeeSummary;
import com.hrflow.onboarding.engine.DuplicateWorkflowException;
import com.hrflow.onboarding.engine.InvalidTransitionException;
import com.hrflow.onboarding.engine.NotFoundException;
import com.hrflow.onboarding.engine.OnboardingException;
import com.hrflow.onboarding.engine.ProgressCalculator;
import com.hrflow.onboarding.engine.ProgressSnapshot;
import com.hrflow.onboarding.engine.StepStateMachine;
import com.hrflow.onboarding.engine.ValidationException;
import com.hrflow.onboarding.engine.WorkflowPersistenceException;
import com.hrflow.onboarding.model.*;
import com.hrflow.onboarding.repository.DocumentRecordRepository;
import com.hrflow.onboarding.repository.ExceptionRecordRepository;
import com.hrflow.onboarding.repository.WorkflowRepository;
import com.hrflow.onboarding.template.TemplateCatalog;
import com.hrflow.onboarding.template.TemplateProperties.StepDefinition;
import com.hrflow.onboarding.template.TemplateProperties.TemplateDefinition;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

/**
 * Core business logic for the onboarding workflow lifecycle.
 *
 * Every mutating command runs in one transaction that starts by locking the
 * workflow row (SELECT FOR UPDATE), so commands against the same workflow are
 * applied one at a time and either fully commit or leave nothing behind.
 * Status changes are delegated to {@link StepStateMachine}; everything derived
 * (stage, percentage, on-track) comes from {@link ProgressCalculator}.
 */
@Service
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    static final Severity DEFAULT_FAILURE_SEVERITY = Severity.HIGH;

    // Partial unique index from V1__create_onboarding_schema.sql.
    static final String ACTIVE_EMPLOYEE_INDEX = "ux_onboarding_workflows_active_employee";

    private final WorkflowRepository        workflowRepo;
    private final ExceptionRecordRepository exceptionRepo;
    private final DocumentRecordRepository  documentRepo;
    private final TemplateCatalog           templates;
    private final StepStateMachine          stateMachine;
    private final ProgressCalculator        calculator;
    private final EmployeeDirectory         employees;
    private final MeterRegistry             meterRegistry;
    private final Clock                     clock;

    public WorkflowEngine(WorkflowRepository workflowRepo,
                          ExceptionRecordRepository exceptionRepo,
                          DocumentRecordRepository documentRepo,
                          TemplateCatalog templates,
                          StepStateMachine stateMachine,
                          ProgressCalculator calculator,
                          EmployeeDirectory employees,
                          MeterRegistry meterRegistry,
                          Clock clock) {
        this.workflowRepo  = workflowRepo;
        this.exceptionRepo = exceptionRepo;
        this.documentRepo  = documentRepo;
        this.templates     = templates;
        this.stateMachine  = stateMachine;
        this.calculator    = calculator;
        this.employees     = employees;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    // ------------------------------------------------------------------
    // Workflow lifecycle
    // ------------------------------------------------------------------

    /**
     * Instantiate a template for one employee.
     *
     * Steps are copied from the template in declaration order; due dates are
     * resolved against the start time. The workflow opens on the first stage
     * that holds a step.
     */
    @Transactional
    public WorkflowInstance createWorkflow(UUID employeeId, String templateId) {
        if (employeeId == null) {
            throw new ValidationException("employeeId is required");
        }
        TemplateDefinition template = templates.get(templateId);
        if (workflowRepo.existsByEmployeeIdAndStatus(employeeId, WorkflowStatus.ACTIVE)) {
            throw new DuplicateWorkflowException(employeeId);
        }

        Instant now = clock.instant();
        WorkflowInstance workflow = new WorkflowInstance(employeeId, templateId, template.expectedDays(), now);
        int order = 1;
        for (StepDefinition definition : template.steps()) {
            StepRecord step = new StepRecord(workflow, order++, definition.stage(), definition.name());
            step.setDescription(definition.description());
            step.setIntegrationType(definition.integrationType());
            if (definition.dueOffsetDays() != null) {
                step.setDueDate(now.plus(Duration.ofDays(definition.dueOffsetDays())));
            }
            step.setPrerequisites(definition.requires());
            workflow.addStep(step);
        }
        workflow.setCurrentStage(calculator.initialStage(workflow.getSteps()));

        WorkflowInstance saved;
        try {
            saved = workflowRepo.saveAndFlush(workflow);
        } catch (DataIntegrityViolationException e) {
            // Lost a race with a concurrent create: the partial unique index on
            // (employee_id) WHERE status = 'ACTIVE' rejected the second row.
            if (violates(e, ACTIVE_EMPLOYEE_INDEX)) {
                throw new DuplicateWorkflowException(employeeId);
            }
            throw persistenceFailure("create workflow for employee " + employeeId, e);
        } catch (DataAccessException e) {
            throw persistenceFailure("create workflow for employee " + employeeId, e);
        }
        log.info("Created workflow {} for employee {} from template '{}' ({} steps, stage={})",
                saved.getId(), employeeId, templateId, saved.getSteps().size(), saved.getCurrentStage().code());
        return saved;
    }

    @Transactional
    public WorkflowInstance cancelWorkflow(UUID workflowId) {
        WorkflowInstance workflow = lock(workflowId);
        requireActive(workflow);
        workflow.setStatus(WorkflowStatus.CANCELLED);
        persist(workflow, "cancel");
        log.info("Cancelled workflow {} at {}% (employee={})",
                workflowId, workflow.getProgressPercentage(), workflow.getEmployeeId());
        return workflow;
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public ProgressSnapshot getProgress(UUID workflowId) {
        return calculator.snapshot(find(workflowId));
    }

    /**
     * Full detail view without the employee. Callers attach it afterwards
     * with {@link #findEmployee}, so the directory call never holds a
     * database connection.
     */
    @Transactional(readOnly = true)
    public WorkflowView getWorkflow(UUID workflowId) {
        WorkflowInstance workflow = find(workflowId);
        List<StepRecord> steps = List.copyOf(workflow.getSteps());
        return new WorkflowView(
                workflow,
                steps,
                calculator.groupByStage(steps),
                List.copyOf(workflow.getExceptions()),
                List.copyOf(workflow.getDocuments()),
                calculator.snapshot(workflow),
                null);
    }

    /**
     * Best-effort employee lookup for the detail view. Runs outside any
     * transaction; returns null when the employee is unknown or the
     * directory cannot be reached.
     */
    public EmployeeSummary findEmployee(UUID employeeId) {
        try {
            return employees.findEmployee(employeeId).orElse(null);
        } catch (EmployeeDirectoryException e) {
            // Non-fatal: the view falls back to the bare employee id.
            log.warn("Employee lookup failed for {}: {}", employeeId, e.getMessage());
            return null;
        }
    }

    /**
     * Dashboard figures. The month is the current calendar month in UTC;
     * the average counts whole days from start to completion.
     */
    @Transactional(readOnly = true)
    public WorkflowStats getStats() {
        Instant monthStart = clock.instant().atZone(ZoneOffset.UTC)
                .withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).toInstant();
        try {
            long active = workflowRepo.countByStatus(WorkflowStatus.ACTIVE);
            List<WorkflowInstance> completed = workflowRepo
                    .findByStatusAndCompletedAtGreaterThanEqual(WorkflowStatus.COMPLETED, monthStart);
            long averageDays = completed.isEmpty() ? 0 : completed.stream()
                    .mapToLong(w -> Duration.between(w.getStartedAt(), w.getCompletedAt()).toDays())
                    .sum() / completed.size();
            return new WorkflowStats(templates.templateIds().size(), active, completed.size(), averageDays);
        } catch (DataAccessException e) {
            throw persistenceFailure("compute workflow stats", e);
        }
    }

    /** @param status null lists every workflow */
    @Transactional(readOnly = true)
    public List<WorkflowInstance> listWorkflows(WorkflowStatus status) {
        return status == null
                ? workflowRepo.findAllByOrderByStartedAtDesc()
                : workflowRepo.findByStatusOrderByStartedAtDesc(status);
    }

    // ------------------------------------------------------------------
    // Step commands
    // ------------------------------------------------------------------

    /**
     * PENDING → IN_PROGRESS. Rejected while any prerequisite step is still
     * open, blocked or failed.
     */
    @Transactional
    public StepCommandResult startStep(UUID workflowId, UUID stepId) {
        return runStepCommand("start", workflowId, stepId,
                step -> step.getStatus() == StepStatus.IN_PROGRESS,
                (workflow, step) -> {
                    if (step.getStatus() == StepStatus.PENDING) {
                        requirePrerequisitesDone(workflow, step);
                    }
                    stateMachine.start(step);
                });
    }

    /** IN_PROGRESS → COMPLETED. @param completedBy optional actor recorded on the step */
    @Transactional
    public StepCommandResult completeStep(UUID workflowId, UUID stepId, String completedBy) {
        return runStepCommand("complete", workflowId, stepId,
                step -> step.getStatus() == StepStatus.COMPLETED,
                (workflow, step) -> stateMachine.complete(step, completedBy));
    }

    /** @param skippedBy optional actor, stored in the same column as a completer */
    @Transactional
    public StepCommandResult skipStep(UUID workflowId, UUID stepId, String reason, String skippedBy) {
        // Checked up front so a missing reason is reported even on a retry.
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("A reason is required to skip a step");
        }
        return runStepCommand("skip", workflowId, stepId,
                step -> step.getStatus() == StepStatus.SKIPPED,
                (workflow, step) -> stateMachine.skip(step, reason, skippedBy));
    }

    /**
     * Mark a step BLOCKED, e.g. while waiting on an external party. An
     * exception is raised only when a severity is given.
     */
    @Transactional
    public StepCommandResult blockStep(UUID workflowId, UUID stepId, String cause, Severity severity) {
        return runStepCommand("block", workflowId, stepId,
                step -> step.getStatus() == StepStatus.BLOCKED,
                (workflow, step) -> {
                    stateMachine.markBlocked(step, cause);
                    if (severity != null) {
                        raise(workflow, step.getId(), ExceptionType.STEP_BLOCKED,
                                "Step blocked: " + step.getName(), step.getStatusCause(), severity);
                    }
                });
    }

    /**
     * Mark a step FAILED after its integration reported an error. Always
     * raises an integration-failure exception, HIGH unless told otherwise.
     */
    @Transactional
    public StepCommandResult failStep(UUID workflowId, UUID stepId, String cause, Severity severity) {
        return runStepCommand("fail", workflowId, stepId,
                step -> step.getStatus() == StepStatus.FAILED,
                (workflow, step) -> {
                    stateMachine.markFailed(step, cause);
                    String title = step.getIntegrationType() != null
                            ? step.getIntegrationType() + " integration failed"
                            : "Step failed: " + step.getName();
                    raise(workflow, step.getId(), ExceptionType.INTEGRATION_FAILURE, title,
                            step.getStatusCause(), severity != null ? severity : DEFAULT_FAILURE_SEVERITY);
                });
    }

    /** BLOCKED | FAILED → PENDING. Related exceptions stay open until resolved. */
    @Transactional
    public StepCommandResult requeueStep(UUID workflowId, UUID stepId) {
        return runStepCommand("requeue", workflowId, stepId,
                step -> false,
                (workflow, step) -> stateMachine.requeue(step));
    }

    // ------------------------------------------------------------------
    // Exceptions
    // ------------------------------------------------------------------

    @Transactional
    public ExceptionRecord raiseException(UUID workflowId, UUID stepId, String title,
                                          String description, Severity severity) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("title is required");
        }
        if (severity == null) {
            throw new ValidationException("severity is required");
        }
        WorkflowInstance workflow = lock(workflowId);
        requireActive(workflow);
        if (stepId != null && workflow.findStep(stepId).isEmpty()) {
            throw new NotFoundException("Step", stepId);
        }
        ExceptionRecord exception = raise(workflow, stepId, ExceptionType.MANUAL,
                title.strip(), description, severity);
        persist(workflow, "raise-exception");
        return exception;
    }

    /** OPEN → RESOLVED. Allowed after the workflow itself has finished. */
    @Transactional
    public ExceptionRecord resolveException(UUID exceptionId, String actor, String note) {
        if (actor == null || actor.isBlank()) {
            throw new ValidationException("resolvedBy is required");
        }
        UUID workflowId = exceptionRepo.findWorkflowIdById(exceptionId)
                .orElseThrow(() -> new NotFoundException("Exception", exceptionId));
        WorkflowInstance workflow = lock(workflowId);
        ExceptionRecord exception = workflow.findException(exceptionId)
                .orElseThrow(() -> new NotFoundException("Exception", exceptionId));
        if (!exception.isOpen()) {
            throw new InvalidTransitionException("Exception " + exceptionId + " is already resolved");
        }
        exception.resolve(actor.strip(), note, clock.instant());
        persist(workflow, "resolve-exception");
        log.info("Exception {} on workflow {} resolved by {}", exceptionId, workflowId, exception.getResolvedBy());
        return exception;
    }

    // ------------------------------------------------------------------
    // Documents
    // ------------------------------------------------------------------

    @Transactional
    public DocumentRecord recordDocument(UUID workflowId, UUID stepId, String documentName,
                                         String documentType, String fileType, long fileSizeBytes) {
        requireText(documentName, "documentName");
        requireText(documentType, "documentType");
        requireText(fileType, "fileType");
        if (fileSizeBytes < 0) {
            throw new ValidationException("fileSizeBytes must not be negative");
        }
        WorkflowInstance workflow = lock(workflowId);
        if (stepId != null && workflow.findStep(stepId).isEmpty()) {
            throw new NotFoundException("Step", stepId);
        }
        DocumentRecord document = new DocumentRecord(workflow, stepId,
                documentName.strip(), documentType.strip(), fileType.strip(), fileSizeBytes, clock.instant());
        insert(documentRepo, document, "record document on workflow " + workflowId);
        workflow.addDocument(document);
        persist(workflow, "record-document");
        log.info("Recorded document '{}' ({}) on workflow {}", document.getDocumentName(), documentType, workflowId);
        return document;
    }

    @Transactional
    public DocumentRecord signDocument(UUID workflowId, UUID documentId) {
        WorkflowInstance workflow = lock(workflowId);
        DocumentRecord document = workflow.findDocument(documentId)
                .orElseThrow(() -> new NotFoundException("Document", documentId));
        if (document.getStatus() != DocumentStatus.GENERATED) {
            throw new InvalidTransitionException("Document " + documentId + " is already "
                    + document.getStatus().code());
        }
        document.markSigned(clock.instant());
        persist(workflow, "sign-document");
        log.info("Document {} on workflow {} signed", documentId, workflowId);
        return document;
    }

    // ------------------------------------------------------------------
    // Step command plumbing
    // ------------------------------------------------------------------

    /**
     * Shared shape of every step command: lock, locate, short-circuit a retry,
     * transition, advance, persist.
     *
     * @param alreadyApplied true when the command's effect is already in place
     * @param transition     applies the change; must throw without side effects if illegal
     */
    private StepCommandResult runStepCommand(String command, UUID workflowId, UUID stepId,
                                             Predicate<StepRecord> alreadyApplied,
                                             BiConsumer<WorkflowInstance, StepRecord> transition) {
        // Tags every log line of this command, including those from the state machine.
        MDC.put("workflowId", String.valueOf(workflowId));
        MDC.put("stepId",     String.valueOf(stepId));
        MDC.put("command",    command);
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "rejected";
        try {
            WorkflowInstance workflow = lock(workflowId);
            StepRecord step = workflow.findStep(stepId)
                    .orElseThrow(() -> new NotFoundException("Step", stepId));

            if (alreadyApplied.test(step)) {
                outcome = CommandOutcome.ALREADY_APPLIED.code();
                log.debug("{} on step {} of workflow {} already applied", command, stepId, workflowId);
                return new StepCommandResult(step, CommandOutcome.ALREADY_APPLIED, calculator.snapshot(workflow));
            }

            requireActive(workflow);
            StepStatus before = step.getStatus();
            transition.accept(workflow, step);
            refresh(workflow);
            persist(workflow, command);

            outcome = CommandOutcome.APPLIED.code();
            log.info("Step '{}' of workflow {}: {} -> {}",
                    step.getName(), workflowId, before.code(), step.getStatus().code());
            return new StepCommandResult(step, CommandOutcome.APPLIED, calculator.snapshot(workflow));
        } catch (OnboardingException e) {
            if (e instanceof WorkflowPersistenceException) {
                outcome = "error";
            }
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("onboarding.command.duration", "command", command));
            meterRegistry.counter("onboarding.step.transitions",
                    "transition", command, "outcome", outcome).increment();
            // Request threads are pooled; remove only what was added here.
            MDC.remove("workflowId");
            MDC.remove("stepId");
            MDC.remove("command");
        }
    }

    /**
     * Re-derive the stored fields after a step changed: advance through every
     * completed stage, close the workflow when nothing is left, and cache the
     * percentage for list views.
     */
    private void refresh(WorkflowInstance workflow) {
        Optional<Stage> next;
        while ((next = calculator.nextStage(workflow)).isPresent()) {
            Stage from = workflow.getCurrentStage();
            workflow.setCurrentStage(next.get());
            log.info("Workflow {} advanced from stage {} to {}",
                    workflow.getId(), from.code(), next.get().code());
        }
        if (calculator.isFinished(workflow)) {
            workflow.setStatus(WorkflowStatus.COMPLETED);
            workflow.setCompletedAt(clock.instant());
            log.info("Workflow {} completed for employee {}", workflow.getId(), workflow.getEmployeeId());
        }
        workflow.setProgressPercentage(calculator.progressPercentage(workflow.getSteps()));
    }

    private void requirePrerequisitesDone(WorkflowInstance workflow, StepRecord step) {
        List<String> waitingOn = step.getPrerequisites().stream()
                .filter(name -> workflow.getSteps().stream()
                        .filter(s -> s.getName().equals(name))
                        .anyMatch(s -> !s.getStatus().isDone()))
                .toList();
        if (!waitingOn.isEmpty()) {
            throw new InvalidTransitionException("Cannot start step '%s' before: %s"
                    .formatted(step.getName(), String.join(", ", waitingOn)));
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ExceptionRecord raise(WorkflowInstance workflow, UUID stepId, ExceptionType type,
                                  String title, String description, Severity severity) {
        ExceptionRecord exception = new ExceptionRecord(
                workflow, stepId, type, title, description, severity, clock.instant());
        insert(exceptionRepo, exception, "raise exception on workflow " + workflow.getId());
        workflow.addException(exception);
        log.warn("Raised {} exception '{}' ({}) on workflow {}",
                type.code(), title, severity.code(), workflow.getId());
        return exception;
    }

    private WorkflowInstance find(UUID workflowId) {
        try {
            return workflowRepo.findById(workflowId)
                    .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
        } catch (DataAccessException e) {
            throw persistenceFailure("load workflow " + workflowId, e);
        }
    }

    /** Load the workflow holding its row lock until the transaction ends. */
    private WorkflowInstance lock(UUID workflowId) {
        try {
            return workflowRepo.findByIdForUpdate(workflowId)
                    .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
        } catch (DataAccessException e) {
            throw persistenceFailure("lock workflow " + workflowId, e);
        }
    }

    /**
     * Persist a new child row directly. Cascading it through
     * {@code saveAndFlush(workflow)} would merge a copy and leave the
     * caller's instance without an id.
     */
    private static <T> void insert(JpaRepository<T, UUID> repository, T entity, String action) {
        try {
            repository.save(entity);
        } catch (DataAccessException e) {
            throw persistenceFailure(action, e);
        }
    }

    private void persist(WorkflowInstance workflow, String command) {
        try {
            workflowRepo.saveAndFlush(workflow);
        } catch (DataAccessException e) {
            throw persistenceFailure(command + " on workflow " + workflow.getId(), e);
        }
    }

    private static WorkflowPersistenceException persistenceFailure(String action, DataAccessException e) {
        log.error("Persistence failure during {}", action, e);
        return new WorkflowPersistenceException("Could not " + action + "; nothing was saved", e);
    }

    private static boolean violates(DataIntegrityViolationException e, String constraint) {
        String message = e.getMostSpecificCause().getMessage();
        return message != null && message.contains(constraint);
    }

    private static void requireActive(WorkflowInstance workflow) {
        if (!workflow.isActive()) {
            throw new InvalidTransitionException("Workflow " + workflow.getId() + " is "
                    + workflow.getStatus().code());
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }
}
