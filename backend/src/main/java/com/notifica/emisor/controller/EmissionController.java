package com.notifica.emisor.controller;

import com.notifica.emisor.batch.EmissionRunModels.EmissionRun;
import com.notifica.emisor.dto.EmissionRequest;
import com.notifica.emisor.dto.EmissionRunSummary;
import com.notifica.emisor.dto.RunStatusDTO;
import com.notifica.emisor.service.EmissionEngine;
import com.notifica.emisor.service.EmissionExportService;
import com.notifica.emisor.service.EmissionValidationException;
import com.notifica.emisor.service.SequenceLookupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/emissions")
public class EmissionController {
    private static final Logger log = LoggerFactory.getLogger(EmissionController.class);

    private final EmissionEngine emissionEngine;
    private final EmissionExportService exportService;

    public EmissionController(EmissionEngine emissionEngine, EmissionExportService exportService) {
        this.emissionEngine = emissionEngine;
        this.exportService = exportService;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> emit(@RequestParam("file") MultipartFile file,
                                  @RequestParam("projectId") Long projectId,
                                  @RequestParam("templateId") Long templateId,
                                  @RequestParam("documentType") String documentType,
                                  @RequestParam(value = "pmoLabel", required = false) String pmoLabel,
                                  @RequestParam("emissionDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate emissionDate,
                                  @RequestParam(value = "requestedBy", required = false) String requestedBy) throws IOException {
        EmissionRequest request = new EmissionRequest(projectId, templateId, documentType, pmoLabel, emissionDate,
                requestedBy, file.getOriginalFilename());
        try {
            EmissionRunSummary summary = emissionEngine.emit(request, file.getBytes());
            return ResponseEntity.ok(summary);
        } catch (EmissionValidationException ex) {
            return validationError(ex);
        } catch (IllegalArgumentException ex) {
            return ProjectController.badRequest(ex.getMessage());
        } catch (SequenceLookupException ex) {
            log.error("[Emission][SequenceLookupFailed] projectId={} msg={}", projectId, ex.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("success", false, "message", ex.getMessage()));
        } catch (IllegalStateException ex) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("success", false, "message", String.valueOf(ex.getMessage())));
        }
    }

    @PostMapping(value = "/async", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> start(@RequestParam("file") MultipartFile file,
                                   @RequestParam("projectId") Long projectId,
                                   @RequestParam("templateId") Long templateId,
                                   @RequestParam("documentType") String documentType,
                                   @RequestParam(value = "pmoLabel", required = false) String pmoLabel,
                                   @RequestParam("emissionDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate emissionDate,
                                   @RequestParam(value = "requestedBy", required = false) String requestedBy) throws IOException {
        EmissionRequest request = new EmissionRequest(projectId, templateId, documentType, pmoLabel, emissionDate,
                requestedBy, file.getOriginalFilename());
        try {
            EmissionRun run = emissionEngine.startAsync(request, file.getBytes());
            return ResponseEntity.accepted().body(Map.of("sessionId", run.sessionId, "state", run.getState().name()));
        } catch (EmissionValidationException ex) {
            return validationError(ex);
        } catch (IllegalStateException ex) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(Map.of("success", false, "message", String.valueOf(ex.getMessage())));
        }
    }

    @PostMapping(value = "/preprocess", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> preprocess(@RequestParam("file") MultipartFile file,
                                        @RequestParam("projectId") Long projectId) throws IOException {
        try {
            return ResponseEntity.ok(emissionEngine.preprocess(projectId, file.getBytes()));
        } catch (EmissionValidationException ex) {
            return validationError(ex);
        } catch (IllegalArgumentException ex) {
            return ProjectController.badRequest(ex.getMessage());
        }
    }

    @PostMapping("/preview")
    public ResponseEntity<?> preview(@RequestParam("projectId") Long projectId,
                                     @RequestParam("templateId") Long templateId,
                                     @RequestParam("account") String account) throws IOException {
        try {
            byte[] pdf = emissionEngine.renderPreview(projectId, templateId, account);
            return ResponseEntity.ok()
                    .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=preview.pdf")
                    .contentType(MediaType.APPLICATION_PDF)
                    .contentLength(pdf.length)
                    .body(new ByteArrayResource(pdf));
        } catch (IllegalArgumentException ex) {
            return ProjectController.badRequest(ex.getMessage());
        } catch (SequenceLookupException ex) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("success", false, "message", ex.getMessage()));
        }
    }

    @GetMapping("/{sessionId}/status")
    public RunStatusDTO status(@PathVariable("sessionId") String sessionId) {
        EmissionRun run = emissionEngine.status(sessionId);
        if (run == null) throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found");
        return new RunStatusDTO(run.sessionId, run.getState().name(), run.total.get(), run.rendered.get(),
                run.failed.get(), run.cancelRequested, run.startedAt, run.finishedAt, run.failureMessage, run.summary);
    }

    @PostMapping("/{sessionId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable("sessionId") String sessionId) {
        boolean accepted = emissionEngine.cancel(sessionId);
        if (!accepted) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("success", false, "message", "Run is unknown or already finished"));
        }
        return ResponseEntity.ok(Map.of("success", true, "sessionId", sessionId));
    }

    @GetMapping("/{sessionId}/artifacts")
    public ResponseEntity<?> artifacts(@PathVariable("sessionId") String sessionId) {
        return ResponseEntity.ok(exportService.artifacts(sessionId));
    }

    @GetMapping("/{sessionId}/zip")
    public ResponseEntity<ByteArrayResource> zip(@PathVariable("sessionId") String sessionId) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try {
            exportService.writeZip(sessionId, baos);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage());
        }
        byte[] bytes = baos.toByteArray();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=emision_" + sessionId + ".zip")
                .contentType(MediaType.parseMediaType("application/zip"))
                .contentLength(bytes.length)
                .body(new ByteArrayResource(bytes));
    }

    private static ResponseEntity<Map<String, Object>> validationError(EmissionValidationException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("message", ex.getMessage());
        if (!ex.getProblems().isEmpty()) body.put("problems", ex.getProblems());
        return ResponseEntity.badRequest().body(body);
    }
}
