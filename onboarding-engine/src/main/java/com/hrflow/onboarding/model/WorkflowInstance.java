package com.hrflow.onboarding.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One employee's onboarding run, instantiated from a template.
 *
 * A WorkflowInstance exclusively owns its steps, exceptions and documents.
 * Steps are provisioned once at creation time and never added or removed
 * afterwards; their order (step_order) is the intended execution order.
 *
 * DB table: onboarding_workflows  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "onboarding_workflows")
public class WorkflowInstance {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Reference into the external employee directory; no FK on our side.
    @Column(name = "employee_id", nullable = false)
    private UUID employeeId;

    @Column(name = "template_id", nullable = false)
    private String templateId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkflowStatus status = WorkflowStatus.ACTIVE;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_stage", nullable = false)
    private Stage currentStage = Stage.PRE_BOARDING;

    // Cached for list views only. Reads always recompute from the steps.
    @Column(name = "progress_percentage", nullable = false)
    private int progressPercentage = 0;

    // Copied from the template at creation so later template edits don't
    // move the goalposts for running workflows.
    @Column(name = "expected_days", nullable = false)
    private int expectedDays;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @OneToMany(mappedBy = "workflow", cascade = CascadeType.ALL, fetch = FetchType.LAZY)
    @OrderBy("stepOrder ASC")
    private List<StepRecord> steps = new ArrayList<>();

    @OneToMany(mappedBy = "workflow", cascade = CascadeType.ALL, fetch = FetchType.LAZY)
    @OrderBy("createdAt ASC")
    private List<ExceptionRecord> exceptions = new ArrayList<>();

    @OneToMany(mappedBy = "workflow", cascade = CascadeType.ALL, fetch = FetchType.LAZY)
    @OrderBy("createdAt ASC")
    private List<DocumentRecord> documents = new ArrayList<>();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected WorkflowInstance() {}   // required by JPA

    public WorkflowInstance(UUID employeeId, String templateId, int expectedDays, Instant startedAt) {
        this.employeeId   = employeeId;
        this.templateId   = templateId;
        this.expectedDays = expectedDays;
        this.startedAt    = startedAt;
    }

    // ------------------------------------------------------------------
    // Aggregate helpers
    // ------------------------------------------------------------------

    /** Provisioning only: appends a step at the next step_order. */
    public StepRecord addStep(StepRecord step) {
        steps.add(step);
        return step;
    }

    public ExceptionRecord addException(ExceptionRecord exception) {
        exceptions.add(exception);
        return exception;
    }

    public DocumentRecord addDocument(DocumentRecord document) {
        documents.add(document);
        return document;
    }

    public Optional<StepRecord> findStep(UUID stepId) {
        return steps.stream().filter(s -> stepId.equals(s.getId())).findFirst();
    }

    public Optional<ExceptionRecord> findException(UUID exceptionId) {
        return exceptions.stream().filter(e -> exceptionId.equals(e.getId())).findFirst();
    }

    public Optional<DocumentRecord> findDocument(UUID documentId) {
        return documents.stream().filter(d -> documentId.equals(d.getId())).findFirst();
    }

    public boolean isActive() {
        return status == WorkflowStatus.ACTIVE;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID           getId()                 { return id; }
    public UUID           getEmployeeId()         { return employeeId; }
    public String         getTemplateId()         { return templateId; }
    public WorkflowStatus getStatus()             { return status; }
    public Stage          getCurrentStage()       { return currentStage; }
    public int            getProgressPercentage() { return progressPercentage; }
    public int            getExpectedDays()       { return expectedDays; }
    public Instant        getStartedAt()          { return startedAt; }
    public Instant        getCompletedAt()        { return completedAt; }
    public Instant        getCreatedAt()          { return createdAt; }
    public Instant        getUpdatedAt()          { return updatedAt; }
    public List<StepRecord>      getSteps()       { return steps; }
    public List<ExceptionRecord> getExceptions()  { return exceptions; }
    public List<DocumentRecord>  getDocuments()   { return documents; }

    public void setStatus(WorkflowStatus status)        { this.status = status; }
    public void setCurrentStage(Stage currentStage)     { this.currentStage = currentStage; }
    public void setProgressPercentage(int v)            { this.progressPercentage = v; }
    public void setCompletedAt(Instant completedAt)     { this.completedAt = completedAt; }
}
