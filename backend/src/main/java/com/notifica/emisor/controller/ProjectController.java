package com.notifica.emisor.controller;

import com.notifica.emisor.dto.ProjectCreateRequest;
import com.notifica.emisor.service.PadronLoadException;
import com.notifica.emisor.service.ProjectService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

    private final ProjectService projectService;

    public ProjectController(ProjectService projectService) {
        this.projectService = projectService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> create(@RequestBody ProjectCreateRequest request) {
        try {
            var project = projectService.create(request);
            return ResponseEntity.status(HttpStatus.CREATED).body(projectService.toDto(project));
        } catch (IllegalArgumentException ex) {
            return badRequest(ex.getMessage());
        }
    }

    @PostMapping(value = "/from-csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> createFromCsv(@RequestParam("name") String name,
                                           @RequestParam(value = "description", required = false) String description,
                                           @RequestParam("file") MultipartFile file,
                                           @RequestParam(value = "detectTypes", defaultValue = "true") boolean detectTypes) throws IOException {
        try (InputStream in = file.getInputStream()) {
            var created = projectService.createFromCsv(name, description, in, detectTypes);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("project", projectService.toDto(created.project()));
            body.put("inserted", created.loaded().inserted());
            body.put("skipped", created.loaded().skipped());
            return ResponseEntity.status(HttpStatus.CREATED).body(body);
        } catch (PadronLoadException ex) {
            return loadFailed(ex);
        } catch (IllegalArgumentException ex) {
            return badRequest(ex.getMessage());
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable("id") Long id) {
        try {
            return ResponseEntity.ok(projectService.toDto(projectService.require(id)));
        } catch (IllegalArgumentException ex) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("success", false, "message", ex.getMessage()));
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable("id") Long id) {
        try {
            boolean dropped = projectService.delete(id);
            return ResponseEntity.ok(Map.of("success", true, "tableDropped", dropped));
        } catch (IllegalArgumentException ex) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("success", false, "message", ex.getMessage()));
        }
    }

    @PostMapping(value = "/{id}/padron", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> loadPadron(@PathVariable("id") Long id,
                                        @RequestParam("file") MultipartFile file,
                                        @RequestParam(value = "merge", defaultValue = "false") boolean merge) throws IOException {
        try (InputStream in = file.getInputStream()) {
            var result = projectService.loadPadron(id, in, merge);
            return ResponseEntity.ok(Map.of(
                    "success", true,
                    "inserted", result.inserted(),
                    "updated", result.updated(),
                    "skipped", result.skipped()
            ));
        } catch (PadronLoadException ex) {
            return loadFailed(ex);
        } catch (IllegalArgumentException ex) {
            return badRequest(ex.getMessage());
        }
    }

    private static ResponseEntity<Map<String, Object>> loadFailed(PadronLoadException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("message", ex.getMessage());
        body.put("row", ex.getRowNumber());
        body.put("inserted", ex.getInserted());
        body.put("updated", ex.getUpdated());
        body.put("skipped", ex.getSkipped());
        return ResponseEntity.unprocessableEntity().body(body);
    }

    @GetMapping("/{id}/padron/structure")
    public ResponseEntity<?> structure(@PathVariable("id") Long id) {
        try {
            return ResponseEntity.ok(projectService.structure(id));
        } catch (IllegalArgumentException ex) {
            return badRequest(ex.getMessage());
        }
    }

    @GetMapping("/{id}/padron/sample")
    public ResponseEntity<?> sample(@PathVariable("id") Long id,
                                    @RequestParam(value = "limit", defaultValue = "10") int limit) {
        try {
            return ResponseEntity.ok(projectService.sample(id, limit));
        } catch (IllegalArgumentException ex) {
            return badRequest(ex.getMessage());
        }
    }

    static ResponseEntity<Map<String, Object>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of(
                "success", false,
                "message", message == null ? "Invalid request" : message
        ));
    }
}
