package com.notifica.emisor.model;

import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One emission run, written once when its batches are dispatched.
 */
@Entity
@Immutable
@Table(name = "emission_session")
public class EmissionSession {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, length = 36, unique = true, updatable = false)
    private String sessionId;

    @Column(name = "project_id", nullable = false, updatable = false)
    private Long projectId;

    @Column(name = "template_id", nullable = false, updatable = false)
    private Long templateId;

    @Column(name = "document_type", nullable = false, length = 50, updatable = false)
    private String documentType;

    @Column(name = "pmo_label", nullable = false, length = 50, updatable = false)
    private String pmoLabel;

    @Column(name = "pmo_sequence", nullable = false, updatable = false)
    private int pmoSequence;

    @Column(name = "emission_date", nullable = false, updatable = false)
    private LocalDate emissionDate;

    @Column(name = "requested_by", length = 100, updatable = false)
    private String requestedBy;

    @Column(name = "source_filename", length = 255, updatable = false)
    private String sourceFilename;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public Long getProjectId() { return projectId; }
    public void setProjectId(Long projectId) { this.projectId = projectId; }
    public Long getTemplateId() { return templateId; }
    public void setTemplateId(Long templateId) { this.templateId = templateId; }
    public String getDocumentType() { return documentType; }
    public void setDocumentType(String documentType) { this.documentType = documentType; }
    public String getPmoLabel() { return pmoLabel; }
    public void setPmoLabel(String pmoLabel) { this.pmoLabel = pmoLabel; }
    public int getPmoSequence() { return pmoSequence; }
    public void setPmoSequence(int pmoSequence) { this.pmoSequence = pmoSequence; }
    public LocalDate getEmissionDate() { return emissionDate; }
    public void setEmissionDate(LocalDate emissionDate) { this.emissionDate = emissionDate; }
    public String getRequestedBy() { return requestedBy; }
    public void setRequestedBy(String requestedBy) { this.requestedBy = requestedBy; }
    public String getSourceFilename() { return sourceFilename; }
    public void setSourceFilename(String sourceFilename) { this.sourceFilename = sourceFilename; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
