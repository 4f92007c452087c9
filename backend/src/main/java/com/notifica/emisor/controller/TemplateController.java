package com.notifica.emisor.controller;

import com.notifica.emisor.dto.TemplateCreateRequest;
import com.notifica.emisor.service.TemplateService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class TemplateController {

    private final TemplateService templateService;

    public TemplateController(TemplateService templateService) {
        this.templateService = templateService;
    }

    @PostMapping(value = "/projects/{projectId}/templates", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> create(@PathVariable("projectId") Long projectId, @RequestBody TemplateCreateRequest request) {
        try {
            var template = templateService.create(projectId, request);
            return ResponseEntity.status(HttpStatus.CREATED).body(templateService.toDto(template));
        } catch (IllegalArgumentException ex) {
            return ProjectController.badRequest(ex.getMessage());
        }
    }

    @GetMapping("/projects/{projectId}/templates")
    public ResponseEntity<?> list(@PathVariable("projectId") Long projectId) {
        try {
            return ResponseEntity.ok(templateService.listForProject(projectId).stream().map(templateService::toDto).toList());
        } catch (IllegalArgumentException ex) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("success", false, "message", ex.getMessage()));
        }
    }

    @GetMapping("/templates/{id}")
    public ResponseEntity<?> get(@PathVariable("id") Long id) {
        try {
            return ResponseEntity.ok(templateService.toDto(templateService.require(id)));
        } catch (IllegalArgumentException ex) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("success", false, "message", ex.getMessage()));
        }
    }
}
