package com.notifica.emisor.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notifica.emisor.dto.TemplateCreateRequest;
import com.notifica.emisor.dto.TemplateDTO;
import com.notifica.emisor.model.FieldMapping;
import com.notifica.emisor.model.PageDimensions;
import com.notifica.emisor.model.Template;
import com.notifica.emisor.repository.TemplateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Service
public class TemplateService {
    private static final Logger log = LoggerFactory.getLogger(TemplateService.class);

    private final TemplateRepository templateRepository;
    private final ProjectService projectService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TemplateService(TemplateRepository templateRepository, ProjectService projectService, ObjectMapper objectMapper, Clock clock) {
        this.templateRepository = templateRepository;
        this.projectService = projectService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Template create(Long projectId, TemplateCreateRequest request) {
        projectService.require(projectId);
        if (request == null || request.name() == null || request.name().isBlank()) {
            throw new IllegalArgumentException("Template name is required");
        }
        double width = request.pageWidthCm() != null ? request.pageWidthCm() : PageDimensions.DEFAULT.widthCm();
        double height = request.pageHeightCm() != null ? request.pageHeightCm() : PageDimensions.DEFAULT.heightCm();
        PageDimensions page = new PageDimensions(width, height);
        List<FieldMapping> fields = request.fieldMap();
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Template must map at least one field");
        }
        for (int i = 0; i < fields.size(); i++) {
            validateField(i, fields.get(i), page);
        }

        Template t = new Template();
        t.setProjectId(projectId);
        t.setName(request.name().trim());
        t.setDescription(request.description());
        t.setPageWidthCm(page.widthCm());
        t.setPageHeightCm(page.heightCm());
        t.setFieldMap(toJson(fields));
        t.setCreatedAt(clock.instant());
        Template saved = templateRepository.save(t);
        log.info("[Template][Create] id={} projectId={} fields={}", saved.getId(), projectId, fields.size());
        return saved;
    }

    private static void validateField(int index, FieldMapping f, PageDimensions page) {
        if (f == null || f.padronField() == null || f.padronField().isBlank()) {
            throw new IllegalArgumentException("Field entry " + (index + 1) + " has no padron_field");
        }
        String name = f.padronField();
        if (f.width() <= 0 || f.height() <= 0) {
            throw new IllegalArgumentException("Field '" + name + "' must have a positive width and height");
        }
        if (f.x() < 0 || f.y() < 0) {
            throw new IllegalArgumentException("Field '" + name + "' has negative coordinates");
        }
        if (f.x() + f.width() > page.widthCm() || f.y() + f.height() > page.heightCm()) {
            log.warn("[Template] field '{}' extends beyond the {}x{} cm page", name, page.widthCm(), page.heightCm());
        }
    }

    public Template require(Long templateId) {
        if (templateId == null) throw new IllegalArgumentException("templateId is required");
        return templateRepository.findByIdAndDeletedFalse(templateId)
                .orElseThrow(() -> new IllegalArgumentException("Template not found: " + templateId));
    }

    public List<Template> listForProject(Long projectId) {
        projectService.require(projectId);
        return templateRepository.findByProjectIdAndDeletedFalseOrderByNameAsc(projectId);
    }

    /** Field entries in declaration order. */
    public List<FieldMapping> fieldMap(Template template) {
        try {
            return objectMapper.readValue(template.getFieldMap(), new TypeReference<List<FieldMapping>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored field map is unreadable for template " + template.getId(), e);
        }
    }

    public TemplateDTO toDto(Template t) {
        return new TemplateDTO(t.getId(), t.getProjectId(), t.getName(), t.getDescription(),
                t.getPageWidthCm(), t.getPageHeightCm(), fieldMap(t));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize field map", e);
        }
    }
}
