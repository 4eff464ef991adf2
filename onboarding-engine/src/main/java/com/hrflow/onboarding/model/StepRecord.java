package com.hrflow.onboarding.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One unit of onboarding work inside a workflow.
 *
 * The status fields (status, startedAt, completedAt, completedBy, skipReason,
 * statusCause) are written by StepStateMachine only.
 *
 * DB table: workflow_steps  (created by Flyway V1 migration, completed_by added in V2)
 */
@Entity
@Table(name = "workflow_steps")
public class StepRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "workflow_id", nullable = false)
    private WorkflowInstance workflow;

    @Column(name = "step_order", nullable = false)
    private int stepOrder;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Stage stage;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    // e.g. "docusign", "payroll-provisioning". Null for manual steps.
    @Column(name = "integration_type")
    private String integrationType;

    @Column(name = "due_date")
    private Instant dueDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StepStatus status = StepStatus.PENDING;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // Who completed or skipped the step, when the caller said so.
    @Column(name = "completed_by")
    private String completedBy;

    // Set iff status = SKIPPED.
    @Column(name = "skip_reason", columnDefinition = "TEXT")
    private String skipReason;

    // Why the step is BLOCKED or FAILED. Cleared on requeue.
    @Column(name = "status_cause", columnDefinition = "TEXT")
    private String statusCause;

    // Names of earlier steps in the same workflow that must be done first.
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "step_prerequisites", joinColumns = @JoinColumn(name = "step_id"))
    @Column(name = "prerequisite_name", nullable = false)
    private List<String> prerequisites = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected StepRecord() {}   // required by JPA

    public StepRecord(WorkflowInstance workflow, int stepOrder, Stage stage, String name) {
        this.workflow  = workflow;
        this.stepOrder = stepOrder;
        this.stage     = stage;
        this.name      = name;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID             getId()              { return id; }
    public WorkflowInstance getWorkflow()        { return workflow; }
    public int              getStepOrder()       { return stepOrder; }
    public Stage            getStage()           { return stage; }
    public String           getName()            { return name; }
    public String           getDescription()     { return description; }
    public String           getIntegrationType() { return integrationType; }
    public Instant          getDueDate()         { return dueDate; }
    public StepStatus       getStatus()          { return status; }
    public Instant          getStartedAt()       { return startedAt; }
    public Instant          getCompletedAt()     { return completedAt; }
    public String           getCompletedBy()     { return completedBy; }
    public String           getSkipReason()      { return skipReason; }
    public String           getStatusCause()     { return statusCause; }
    public List<String>     getPrerequisites()   { return prerequisites; }
    public Instant          getCreatedAt()       { return createdAt; }

    public void setDescription(String description)         { this.description = description; }
    public void setIntegrationType(String integrationType) { this.integrationType = integrationType; }
    public void setDueDate(Instant dueDate)                { this.dueDate = dueDate; }
    public void setPrerequisites(List<String> names)       { this.prerequisites = new ArrayList<>(names); }

    public void setStatus(StepStatus status)               { this.status = status; }
    public void setStartedAt(Instant t)                    { this.startedAt = t; }
    public void setCompletedAt(Instant t)                  { this.completedAt = t; }
    public void setCompletedBy(String actor)               { this.completedBy = actor; }
    public void setSkipReason(String skipReason)           { this.skipReason = skipReason; }
    public void setStatusCause(String statusCause)         { this.statusCause = statusCause; }
}
