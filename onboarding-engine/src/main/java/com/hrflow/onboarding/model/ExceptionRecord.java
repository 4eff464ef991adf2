package com.hrflow.onboarding.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A flagged problem in a workflow, optionally tied to one step.
 *
 * Raised by the engine (failed or blocked step) or by an operator.
 * Resolution always names the actor who resolved it.
 *
 * DB table: workflow_exceptions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workflow_exceptions")
public class ExceptionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "workflow_id", nullable = false)
    private WorkflowInstance workflow;

    // Nullable: workflow-level exceptions have no step.
    @Column(name = "step_id")
    private UUID stepId;

    @Enumerated(EnumType.STRING)
    @Column(name = "exception_type", nullable = false)
    private ExceptionType exceptionType;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Severity severity;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution_status", nullable = false)
    private ResolutionStatus resolutionStatus = ResolutionStatus.OPEN;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolved_by")
    private String resolvedBy;

    @Column(name = "resolution_note", columnDefinition = "TEXT")
    private String resolutionNote;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected ExceptionRecord() {}   // required by JPA

    public ExceptionRecord(WorkflowInstance workflow, UUID stepId, ExceptionType exceptionType,
                           String title, String description, Severity severity, Instant createdAt) {
        this.workflow      = workflow;
        this.stepId        = stepId;
        this.exceptionType = exceptionType;
        this.title         = title;
        this.description   = description;
        this.severity      = severity;
        this.createdAt     = createdAt;
    }

    /** Mark resolved. The caller has already checked the record is OPEN. */
    public void resolve(String actor, String note, Instant at) {
        this.resolutionStatus = ResolutionStatus.RESOLVED;
        this.resolvedBy       = actor;
        this.resolutionNote   = note;
        this.resolvedAt       = at;
    }

    public boolean isOpen() {
        return resolutionStatus == ResolutionStatus.OPEN;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID             getId()               { return id; }
    public WorkflowInstance getWorkflow()         { return workflow; }
    public UUID             getStepId()           { return stepId; }
    public ExceptionType    getExceptionType()    { return exceptionType; }
    public String           getTitle()            { return title; }
    public String           getDescription()      { return description; }
    public Severity         getSeverity()         { return severity; }
    public ResolutionStatus getResolutionStatus() { return resolutionStatus; }
    public Instant          getCreatedAt()        { return createdAt; }
    public Instant          getResolvedAt()       { return resolvedAt; }
    public String           getResolvedBy()       { return resolvedBy; }
    public String           getResolutionNote()   { return resolutionNote; }
}
