package com.notifica.emisor.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "template")
public class Template {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false)
    private Long projectId;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "page_width_cm", nullable = false)
    private double pageWidthCm = PageDimensions.DEFAULT.widthCm();

    @Column(name = "page_height_cm", nullable = false)
    private double pageHeightCm = PageDimensions.DEFAULT.heightCm();

    @Column(name = "field_map", nullable = false, columnDefinition = "TEXT")
    private String fieldMap; // JSON array of FieldMapping

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public PageDimensions pageDimensions() {
        return new PageDimensions(pageWidthCm, pageHeightCm);
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getProjectId() { return projectId; }
    public void setProjectId(Long projectId) { this.projectId = projectId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public double getPageWidthCm() { return pageWidthCm; }
    public void setPageWidthCm(double pageWidthCm) { this.pageWidthCm = pageWidthCm; }
    public double getPageHeightCm() { return pageHeightCm; }
    public void setPageHeightCm(double pageHeightCm) { this.pageHeightCm = pageHeightCm; }
    public String getFieldMap() { return fieldMap; }
    public void setFieldMap(String fieldMap) { this.fieldMap = fieldMap; }
    public boolean isDeleted() { return deleted; }
    public void setDeleted(boolean deleted) { this.deleted = deleted; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
