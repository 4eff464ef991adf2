package com.hrflow.onboarding.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Metadata for a document generated or required during onboarding.
 *
 * The file itself lives in external storage. This row is immutable
 * apart from the single GENERATED → SIGNED transition.
 *
 * DB table: workflow_documents  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workflow_documents")
public class DocumentRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "workflow_id", nullable = false)
    private WorkflowInstance workflow;

    @Column(name = "step_id", updatable = false)
    private UUID stepId;

    @Column(name = "document_name", nullable = false, updatable = false)
    private String documentName;

    // e.g. "offer-letter", "i9", "w4", "handbook"
    @Column(name = "document_type", nullable = false, updatable = false)
    private String documentType;

    // e.g. "pdf", "docx"
    @Column(name = "file_type", nullable = false, updatable = false)
    private String fileType;

    @Column(name = "file_size_bytes", nullable = false, updatable = false)
    private long fileSizeBytes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DocumentStatus status = DocumentStatus.GENERATED;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "signed_at")
    private Instant signedAt;

    protected DocumentRecord() {}   // required by JPA

    public DocumentRecord(WorkflowInstance workflow, UUID stepId, String documentName,
                          String documentType, String fileType, long fileSizeBytes, Instant createdAt) {
        this.workflow      = workflow;
        this.stepId        = stepId;
        this.documentName  = documentName;
        this.documentType  = documentType;
        this.fileType      = fileType;
        this.fileSizeBytes = fileSizeBytes;
        this.createdAt     = createdAt;
    }

    public void markSigned(Instant at) {
        this.status   = DocumentStatus.SIGNED;
        this.signedAt = at;
    }

    public UUID             getId()            { return id; }
    public WorkflowInstance getWorkflow()      { return workflow; }
    public UUID             getStepId()        { return stepId; }
    public String           getDocumentName()  { return documentName; }
    public String           getDocumentType()  { return documentType; }
    public String           getFileType()      { return fileType; }
    public long             getFileSizeBytes() { return fileSizeBytes; }
    public DocumentStatus   getStatus()        { return status; }
    public Instant          getCreatedAt()     { return createdAt; }
    public Instant          getSignedAt()      { return signedAt; }
}
