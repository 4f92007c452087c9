package com.notifica.emisor.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notifica.emisor.batch.BatchResult;
import com.notifica.emisor.batch.EmissionJob;
import com.notifica.emisor.batch.RenderContext;
import com.notifica.emisor.dto.RecordError;
import com.notifica.emisor.model.BarcodeImage;
import com.notifica.emisor.model.EmissionArtifact;
import com.notifica.emisor.util.Hashing;
import com.notifica.emisor.util.TextFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders one batch of resolved jobs on a pool thread. Every job ends with exactly one artifact
 * write, successful or not; a failing job never stops the rest of the batch.
 */
@Component
public class RenderWorker {
    private static final Logger log = LoggerFactory.getLogger(RenderWorker.class);

    private final BarcodeGenerator barcodeGenerator;
    private final PdfRenderer pdfRenderer;
    private final AuditRecorder auditRecorder;
    private final TextFormatter formatter;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RenderWorker(BarcodeGenerator barcodeGenerator,
                        PdfRenderer pdfRenderer,
                        AuditRecorder auditRecorder,
                        TextFormatter formatter,
                        ObjectMapper objectMapper,
                        Clock clock) {
        this.barcodeGenerator = barcodeGenerator;
        this.pdfRenderer = pdfRenderer;
        this.auditRecorder = auditRecorder;
        this.formatter = formatter;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public BatchResult renderBatch(RenderContext ctx, List<EmissionJob> jobs) {
        int rendered = 0, failed = 0;
        List<RecordError> errors = new ArrayList<>();
        String worker = Thread.currentThread().getName();
        long t0 = System.currentTimeMillis();

        for (EmissionJob job : jobs) {
            EmissionArtifact artifact = baseArtifact(ctx, job, worker);
            try {
                BarcodeImage barcode = ctx.hasBarcodeField() ? barcodeGenerator.render(job.barcodePayload(), ctx.symbology()) : null;
                byte[] pdf = pdfRenderer.render(ctx.fields(), ctx.page(), job.data(), barcode);
                Path file = ctx.outputDir().resolve(fileNameFor(job.account()));
                Files.write(file, pdf);
                artifact.setFilePath(file.toAbsolutePath().toString());
                artifact.setFileSize((long) pdf.length);
                artifact.setSha256Hash(Hashing.sha256Hex(pdf));
                artifact.setRenderedAt(clock.instant());
            } catch (Exception e) {
                String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                log.warn("[Emission][RecordFailed] sessionId={} account={} printOrder={} reason={}",
                        ctx.sessionId(), job.account(), job.printOrder(), message);
                artifact.setError(message);
                errors.add(new RecordError(job.account(), job.printOrder(), message));
            }

            boolean success = artifact.getError() == null;
            try {
                auditRecorder.record(artifact);
            } catch (RuntimeException e) {
                log.error("[Emission][AuditWriteFailed] sessionId={} account={} printOrder={}",
                        ctx.sessionId(), job.account(), job.printOrder(), e);
                errors.add(new RecordError(job.account(), job.printOrder(), "Audit write failed: " + e.getMessage()));
                success = false;
            }
            if (success) rendered++; else failed++;
        }

        log.info("[Emission][BatchDone] sessionId={} worker={} size={} rendered={} failed={} durationMs={}",
                ctx.sessionId(), worker, jobs.size(), rendered, failed, System.currentTimeMillis() - t0);
        return new BatchResult(rendered, failed, errors);
    }

    private EmissionArtifact baseArtifact(RenderContext ctx, EmissionJob job, String worker) {
        EmissionArtifact a = new EmissionArtifact();
        a.setSessionId(ctx.sessionId());
        a.setProjectId(ctx.projectId());
        a.setTemplateId(ctx.templateId());
        a.setAccount(job.account());
        a.setPrintOrder(job.printOrder());
        a.setDocumentType(ctx.documentType());
        a.setPmoLabel(ctx.pmoLabel());
        a.setEmissionDate(ctx.emissionDate());
        a.setVisitaCode(job.visitaCode());
        a.setBarcodePayload(job.barcodePayload());
        a.setRenderedBy(worker);
        a.setDataJson(dataJson(job.data()));
        return a;
    }

    /** Display form of every value, as the notice shows them without field-specific formats. */
    String dataJson(Map<String, Object> data) {
        Map<String, String> formatted = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : data.entrySet()) {
            formatted.put(e.getKey(), formatter.format(e.getValue()));
        }
        try {
            return objectMapper.writeValueAsString(formatted);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Record data is not serializable", e);
        }
    }

    /** Account reduced to a safe file name; path separators and other specials become '_'. */
    static String fileNameFor(String account) {
        String safe = account.replaceAll("[^A-Za-z0-9._-]", "_");
        if (safe.isEmpty() || safe.chars().allMatch(c -> c == '.')) safe = "_";
        return safe + ".pdf";
    }
}
