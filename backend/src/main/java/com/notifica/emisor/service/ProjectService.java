package com.notifica.emisor.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notifica.emisor.dto.ColumnDescription;
import com.notifica.emisor.dto.PadronLoadResult;
import com.notifica.emisor.dto.ProjectCreateRequest;
import com.notifica.emisor.dto.ProjectDTO;
import com.notifica.emisor.model.PadronColumn;
import com.notifica.emisor.model.Project;
import com.notifica.emisor.repository.ProjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class ProjectService {
    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

    private final ProjectRepository projectRepository;
    private final SchemaManager schemaManager;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ProjectService(ProjectRepository projectRepository, SchemaManager schemaManager, ObjectMapper objectMapper, Clock clock) {
        this.projectRepository = projectRepository;
        this.schemaManager = schemaManager;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /** Creates the project row together with its padron table. The table is dropped again if the row cannot be saved. */
    public Project create(ProjectCreateRequest request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            throw new IllegalArgumentException("Project name is required");
        }
        String name = request.name().trim();
        if (projectRepository.existsByNameIgnoreCaseAndDeletedFalse(name)) {
            throw new IllegalArgumentException("A project named '" + name + "' already exists");
        }
        List<PadronColumn> columns = schemaManager.normalizeColumns(request.columns());
        String uuid = UUID.randomUUID().toString();
        String table = schemaManager.createTable(uuid, columns);

        Project p = new Project();
        p.setUuid(uuid);
        p.setName(name);
        p.setDescription(request.description());
        p.setPadronTable(table);
        p.setPadronSchema(toJson(columns));
        p.setCreatedAt(clock.instant());
        p.setUpdatedAt(p.getCreatedAt());
        try {
            Project saved = projectRepository.save(p);
            log.info("[Project][Create] id={} name='{}' table={}", saved.getId(), name, table);
            return saved;
        } catch (RuntimeException e) {
            schemaManager.dropTable(table);
            throw e;
        }
    }

    /** A project created from a CSV together with the counts of its first padron load. */
    public record CreatedFromCsv(Project project, PadronLoadResult loaded) {}

    /**
     * Creates a project whose padron schema is inferred from the CSV, then loads the CSV rows into it.
     * When the load fails the project row and its table are removed again.
     */
    public CreatedFromCsv createFromCsv(String name, String description, InputStream csv, boolean detectTypes) throws IOException {
        SchemaManager.InferredPadron inferred = schemaManager.inferFromCsv(csv, detectTypes);
        Project project = create(new ProjectCreateRequest(name, description, inferred.columns()));
        try {
            PadronLoadResult loaded = schemaManager.loadRows(project.getPadronTable(), columns(project), inferred.rows(), false);
            log.info("[Project][CreateFromCsv] id={} columns={} inserted={} skipped={}", project.getId(),
                    inferred.columns().size(), loaded.inserted(), loaded.skipped());
            return new CreatedFromCsv(project, loaded);
        } catch (RuntimeException e) {
            log.warn("[Project][CreateFromCsv] removing id={} table={} reason={}", project.getId(), project.getPadronTable(), e.getMessage());
            projectRepository.delete(project);
            schemaManager.dropTable(project.getPadronTable());
            throw e;
        }
    }

    public Project require(Long projectId) {
        if (projectId == null) throw new IllegalArgumentException("projectId is required");
        return projectRepository.findByIdAndDeletedFalse(projectId)
                .orElseThrow(() -> new IllegalArgumentException("Project not found: " + projectId));
    }

    /** Soft-deletes the project and drops its padron table. */
    public boolean delete(Long projectId) {
        Project p = require(projectId);
        p.setDeleted(true);
        p.setUpdatedAt(clock.instant());
        projectRepository.save(p);
        boolean dropped = schemaManager.dropTable(p.getPadronTable());
        log.info("[Project][Delete] id={} table={} dropped={}", projectId, p.getPadronTable(), dropped);
        return dropped;
    }

    public List<PadronColumn> columns(Project project) {
        try {
            return objectMapper.readValue(project.getPadronSchema(), new TypeReference<List<PadronColumn>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored padron schema is unreadable for project " + project.getId(), e);
        }
    }

    public PadronLoadResult loadPadron(Long projectId, InputStream csv, boolean merge) throws IOException {
        Project p = require(projectId);
        return schemaManager.loadCsv(p.getPadronTable(), columns(p), csv, merge);
    }

    public List<ColumnDescription> structure(Long projectId) {
        return schemaManager.describe(require(projectId).getPadronTable());
    }

    public List<Map<String, Object>> sample(Long projectId, int limit) {
        return schemaManager.sampleRows(require(projectId).getPadronTable(), limit);
    }

    public ProjectDTO toDto(Project p) {
        return new ProjectDTO(p.getId(), p.getUuid(), p.getName(), p.getDescription(), p.getPadronTable(), columns(p), p.getCreatedAt());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize padron schema", e);
        }
    }
}
