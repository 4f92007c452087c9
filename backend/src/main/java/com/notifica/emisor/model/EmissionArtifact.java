package com.notifica.emisor.model;

import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Audit row for one attempted record of a run. A non-null {@code error} means no PDF was produced.
 * Rows are inserted once and never updated.
 */
@Entity
@Immutable
@Table(name = "emission_artifact", indexes = {
        @Index(name = "idx_artifact_session", columnList = "session_id"),
        @Index(name = "idx_artifact_project_created", columnList = "project_id,created_at"),
        @Index(name = "idx_artifact_project_account", columnList = "project_id,account,emission_date")
})
public class EmissionArtifact {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, length = 36, updatable = false)
    private String sessionId;

    @Column(name = "project_id", nullable = false, updatable = false)
    private Long projectId;

    @Column(name = "template_id", nullable = false, updatable = false)
    private Long templateId;

    @Column(nullable = false, length = 100, updatable = false)
    private String account;

    @Column(name = "print_order", nullable = false, updatable = false)
    private int printOrder;

    @Column(name = "data_json", nullable = false, columnDefinition = "TEXT", updatable = false)
    private String dataJson;

    @Column(name = "document_type", nullable = false, length = 50, updatable = false)
    private String documentType;

    @Column(name = "pmo_label", nullable = false, length = 50, updatable = false)
    private String pmoLabel;

    @Column(name = "emission_date", nullable = false, updatable = false)
    private LocalDate emissionDate;

    @Column(name = "visita_code", nullable = false, length = 50, updatable = false)
    private String visitaCode;

    @Column(name = "barcode_payload", length = 500, updatable = false)
    private String barcodePayload;

    @Column(name = "file_path", length = 1000, updatable = false)
    private String filePath;

    @Column(name = "file_size", updatable = false)
    private Long fileSize;

    @Column(name = "sha256_hash", length = 64, updatable = false)
    private String sha256Hash;

    @Column(name = "rendered_by", length = 100, updatable = false)
    private String renderedBy;

    @Column(name = "rendered_at", updatable = false)
    private Instant renderedAt;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String error;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public boolean isSuccessful() { return error == null; }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public Long getProjectId() { return projectId; }
    public void setProjectId(Long projectId) { this.projectId = projectId; }
    public Long getTemplateId() { return templateId; }
    public void setTemplateId(Long templateId) { this.templateId = templateId; }
    public String getAccount() { return account; }
    public void setAccount(String account) { this.account = account; }
    public int getPrintOrder() { return printOrder; }
    public void setPrintOrder(int printOrder) { this.printOrder = printOrder; }
    public String getDataJson() { return dataJson; }
    public void setDataJson(String dataJson) { this.dataJson = dataJson; }
    public String getDocumentType() { return documentType; }
    public void setDocumentType(String documentType) { this.documentType = documentType; }
    public String getPmoLabel() { return pmoLabel; }
    public void setPmoLabel(String pmoLabel) { this.pmoLabel = pmoLabel; }
    public LocalDate getEmissionDate() { return emissionDate; }
    public void setEmissionDate(LocalDate emissionDate) { this.emissionDate = emissionDate; }
    public String getVisitaCode() { return visitaCode; }
    public void setVisitaCode(String visitaCode) { this.visitaCode = visitaCode; }
    public String getBarcodePayload() { return barcodePayload; }
    public void setBarcodePayload(String barcodePayload) { this.barcodePayload = barcodePayload; }
    public String getFilePath() { return filePath; }
    public void setFilePath(String filePath) { this.filePath = filePath; }
    public Long getFileSize() { return fileSize; }
    public void setFileSize(Long fileSize) { this.fileSize = fileSize; }
    public String getSha256Hash() { return sha256Hash; }
    public void setSha256Hash(String sha256Hash) { this.sha256Hash = sha256Hash; }
    public String getRenderedBy() { return renderedBy; }
    public void setRenderedBy(String renderedBy) { this.renderedBy = renderedBy; }
    public Instant getRenderedAt() { return renderedAt; }
    public void setRenderedAt(Instant renderedAt) { this.renderedAt = renderedAt; }
    public String getError() { return error; }
    public void setError(String error) { this.error = error; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
