package com.notifica.emisor.service;

import com.notifica.emisor.batch.BatchResult;
import com.notifica.emisor.batch.EmissionJob;
import com.notifica.emisor.batch.EmissionRunModels.EmissionRun;
import com.notifica.emisor.batch.EmissionRunModels.RunState;
import com.notifica.emisor.batch.InMemoryRunStore;
import com.notifica.emisor.batch.RenderContext;
import com.notifica.emisor.config.EmissionSettings;
import com.notifica.emisor.dto.EmissionRequest;
import com.notifica.emisor.dto.EmissionRunSummary;
import com.notifica.emisor.dto.PreprocessResponse;
import com.notifica.emisor.dto.RecordError;
import com.notifica.emisor.model.BarcodeImage;
import com.notifica.emisor.model.EmissionSession;
import com.notifica.emisor.model.FieldMapping;
import com.notifica.emisor.model.InputRecord;
import com.notifica.emisor.model.Project;
import com.notifica.emisor.model.Template;
import com.notifica.emisor.repository.EmissionSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.concurrent.CompletableFuture;

/**
 * Runs an emission end to end: CSV load and validation, padron match, sequential derivation of the
 * numbered fields, concurrent batch rendering, aggregation.
 * <p>
 * Everything up to dispatch happens on the calling thread, so sequence numbers are assigned in
 * print order without locks. Workers receive fully resolved jobs.
 */
@Service
public class EmissionEngine {
    private static final Logger log = LoggerFactory.getLogger(EmissionEngine.class);

    public static final String PREVIEW_DOCUMENT_TYPE = "PRUEBA";
    private static final DateTimeFormatter DIR_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final ProjectService projectService;
    private final TemplateService templateService;
    private final SchemaManager schemaManager;
    private final EmissionCsvLoader csvLoader;
    private final SequenceResolver sequenceResolver;
    private final RenderWorker renderWorker;
    private final BarcodeGenerator barcodeGenerator;
    private final PdfRenderer pdfRenderer;
    private final EmissionSessionRepository sessionRepository;
    private final UnmatchedReportWriter unmatchedReportWriter;
    private final InMemoryRunStore runStore;
    private final EmissionSettings settings;
    private final ThreadPoolTaskExecutor renderExecutor;
    private final ThreadPoolTaskExecutor coordinatorExecutor;
    private final Clock clock;

    public EmissionEngine(ProjectService projectService,
                          TemplateService templateService,
                          SchemaManager schemaManager,
                          EmissionCsvLoader csvLoader,
                          SequenceResolver sequenceResolver,
                          RenderWorker renderWorker,
                          BarcodeGenerator barcodeGenerator,
                          PdfRenderer pdfRenderer,
                          EmissionSessionRepository sessionRepository,
                          UnmatchedReportWriter unmatchedReportWriter,
                          InMemoryRunStore runStore,
                          EmissionSettings settings,
                          @Qualifier("renderExecutor") ThreadPoolTaskExecutor renderExecutor,
                          @Qualifier("emissionCoordinatorExecutor") ThreadPoolTaskExecutor coordinatorExecutor,
                          Clock clock) {
        this.projectService = projectService;
        this.templateService = templateService;
        this.schemaManager = schemaManager;
        this.csvLoader = csvLoader;
        this.sequenceResolver = sequenceResolver;
        this.renderWorker = renderWorker;
        this.barcodeGenerator = barcodeGenerator;
        this.pdfRenderer = pdfRenderer;
        this.sessionRepository = sessionRepository;
        this.unmatchedReportWriter = unmatchedReportWriter;
        this.runStore = runStore;
        this.settings = settings;
        this.renderExecutor = renderExecutor;
        this.coordinatorExecutor = coordinatorExecutor;
        this.clock = clock;
    }

    /** Runs an emission on the calling thread and returns its summary. */
    public EmissionRunSummary emit(EmissionRequest request, byte[] csv) {
        EmissionRun run = new EmissionRun();
        runStore.put(run);
        return execute(run, request, csv);
    }

    /**
     * Starts an emission on the coordinator pool. Request and CSV size are checked before this returns;
     * everything else is reported through {@link #status(String)}.
     */
    public EmissionRun startAsync(EmissionRequest request, byte[] csv) {
        validateRequest(request);
        checkSize(csv);
        EmissionRun run = new EmissionRun();
        runStore.put(run);
        try {
            coordinatorExecutor.execute(() -> {
                try {
                    execute(run, request, csv);
                } catch (RuntimeException e) {
                    // already recorded on the run by execute()
                    log.debug("[Emission][AsyncEnded] sessionId={} state={}", run.sessionId, run.getState());
                }
            });
        } catch (TaskRejectedException e) {
            fail(run, "Emission queue is full, try again later");
            throw new IllegalStateException("Emission queue is full", e);
        }
        log.info("[Emission][AsyncStart] sessionId={} projectId={}", run.sessionId, request.projectId());
        return run;
    }

    public EmissionRun status(String sessionId) {
        return runStore.get(sessionId);
    }

    /**
     * Flags a run for cancellation. Only honored before dispatch; afterwards batches run to completion.
     * Returns false for unknown or already finished runs.
     */
    public boolean cancel(String sessionId) {
        EmissionRun run = runStore.get(sessionId);
        if (run == null || run.getState().isTerminal()) return false;
        run.cancelRequested = true;
        log.info("[Emission][CancelRequested] sessionId={} state={}", sessionId, run.getState());
        return true;
    }

    EmissionRunSummary execute(EmissionRun run, EmissionRequest request, byte[] csv) {
        long t0 = System.nanoTime();
        run.startedAt = clock.instant();
        Project project = null;
        LoadedRun loaded = null;
        try {
            validateRequest(request);
            checkSize(csv);
            project = projectService.require(request.projectId());
            Template template = templateService.require(request.templateId());
            if (!project.getId().equals(template.getProjectId())) {
                throw new EmissionValidationException("Template " + template.getId() + " does not belong to project " + project.getId());
            }
            List<FieldMapping> fields = templateService.fieldMap(template);

            EmissionCsvLoader.LoadedCsv csvData = csvLoader.load(csv);
            run.total.set(csvData.records().size());
            run.transition(RunState.CSV_LOADED);
            log.info("[Emission][CsvLoaded] sessionId={} records={} accounts={}", run.sessionId,
                    csvData.records().size(), csvData.uniqueAccounts().size());
            if (run.cancelRequested) return cancelled(run, csvData, t0);

            Map<String, Map<String, Object>> padron = matchPadron(project, csvData.uniqueAccounts());
            loaded = new LoadedRun(csvData, padron);
            List<InputRecord> matched = loaded.matchedInPrintOrder();

            int pmoSequence = sequenceResolver.resolvePmoSequence(project.getId());
            SequenceResolver.VisitaTracker visitas = sequenceResolver.visitaTracker(
                    project.getId(), request.documentType(), loaded.matchedAccounts());
            String pmoLabel = request.pmoLabel() != null && !request.pmoLabel().isBlank()
                    ? request.pmoLabel().trim()
                    : SequenceResolver.pmoLabel(pmoSequence);
            LocalDate emissionDate = request.emissionDate();
            Path outputDir = settings.getOutputRoot()
                    .resolve(String.valueOf(project.getId()))
                    .resolve(emissionDate.format(DIR_DATE));
            createDirectories(outputDir);

            EmissionSession session = new EmissionSession();
            session.setSessionId(run.sessionId);
            session.setProjectId(project.getId());
            session.setTemplateId(template.getId());
            session.setDocumentType(request.documentType());
            session.setPmoLabel(pmoLabel);
            session.setPmoSequence(pmoSequence);
            session.setEmissionDate(emissionDate);
            session.setRequestedBy(request.requestedBy());
            session.setSourceFilename(request.sourceFilename());
            session.setCreatedAt(clock.instant());
            sessionRepository.save(session);
            run.transition(RunState.MATCHED);
            log.info("[Emission][Matched] sessionId={} matchedRecords={} unmatchedAccounts={} pmo='{}'",
                    run.sessionId, matched.size(), loaded.unmatchedAccounts().size(), pmoLabel);

            List<EmissionJob> jobs = new ArrayList<>(matched.size());
            for (InputRecord rec : matched) {
                String visita = visitas.next(rec.account());
                String payload = SequenceResolver.barcodePayload(rec.account(), emissionDate, visita);
                Map<String, Object> data = buildData(padron.get(rec.account()), rec, pmoSequence, pmoLabel,
                        visita, payload, request.documentType(), emissionDate);
                jobs.add(new EmissionJob(rec.account(), rec.printOrder(), visita, payload, data));
            }
            if (run.cancelRequested) return cancelled(run, csvData, t0);

            RenderContext ctx = new RenderContext(run.sessionId, project.getId(), template.getId(),
                    request.documentType(), pmoLabel, emissionDate, fields, template.pageDimensions(),
                    settings.getBarcodeSymbology(), outputDir);
            run.transition(RunState.BATCHES_DISPATCHED);
            List<BatchResult> results = dispatch(run, ctx, jobs);

            int rendered = 0, failed = 0;
            for (BatchResult r : results) {
                rendered += r.rendered();
                failed += r.failed();
                run.errors.addAll(r.errors());
            }
            run.rendered.set(rendered);
            run.failed.set(failed);
            run.transition(RunState.AGGREGATED);

            String reportPath = null;
            if (settings.isUnmatchedReport() && !loaded.unmatchedAccounts().isEmpty()) {
                try {
                    reportPath = unmatchedReportWriter.write(outputDir, run.sessionId, loaded.unmatchedAccounts()).toString();
                } catch (IOException e) {
                    log.warn("[Emission][UnmatchedReportFailed] sessionId={} reason={}", run.sessionId, e.getMessage());
                    run.errors.add(new RecordError(null, null, "Unmatched report could not be written: " + e.getMessage()));
                }
            }

            run.transition(RunState.DONE);
            EmissionRunSummary summary = summarize(run, loaded, t0);
            summary.setOutputPath(outputDir.toAbsolutePath().toString());
            summary.setUnmatchedReportPath(reportPath);
            summary.setPmoLabel(pmoLabel);
            summary.setPmoSequence(pmoSequence);
            finish(run, summary);
            log.info("[Emission][Done] sessionId={} pdfs={} failed={} unmatched={} elapsedSec={}",
                    run.sessionId, rendered, failed, loaded.unmatchedAccounts().size(), summary.getElapsedSeconds());
            return summary;
        } catch (RuntimeException e) {
            if (run.isBeforeMatch()) {
                fail(run, e.getMessage());
                EmissionRunSummary summary = summarize(run, loaded, t0);
                summary.getErrors().add(String.valueOf(e.getMessage()));
                finish(run, summary);
                log.warn("[Emission][Failed] sessionId={} projectId={} reason={}", run.sessionId,
                        project != null ? project.getId() : null, e.getMessage());
            } else {
                log.error("[Emission][Aborted] sessionId={} state={}", run.sessionId, run.getState(), e);
                run.failureMessage = e.getMessage();
                run.finishedAt = clock.instant();
            }
            throw e;
        }
    }

    private Map<String, Map<String, Object>> matchPadron(Project project, Set<String> accounts) {
        try {
            return schemaManager.findByAccounts(project.getPadronTable(), accounts);
        } catch (DataAccessException e) {
            throw new IllegalStateException("Padron lookup failed for project " + project.getId() + ": " + e.getMessage(), e);
        }
    }

    private List<BatchResult> dispatch(EmissionRun run, RenderContext ctx, List<EmissionJob> jobs) {
        int batchSize = settings.getBatchSize();
        List<CompletableFuture<BatchResult>> futures = new ArrayList<>();
        for (int from = 0; from < jobs.size(); from += batchSize) {
            List<EmissionJob> batch = List.copyOf(jobs.subList(from, Math.min(jobs.size(), from + batchSize)));
            int batchNo = from / batchSize + 1;
            log.debug("[Emission][BatchStart] sessionId={} batch={} size={}", run.sessionId, batchNo, batch.size());
            CompletableFuture<BatchResult> f = CompletableFuture
                    .supplyAsync(() -> renderWorker.renderBatch(ctx, batch), renderExecutor)
                    .exceptionally(ex -> {
                        log.error("[Emission][BatchFailed] sessionId={} batch={}", run.sessionId, batchNo, ex);
                        return BatchResult.failedBatch(batch, ex);
                    });
            futures.add(f.thenApply(r -> {
                run.rendered.addAndGet(r.rendered());
                run.failed.addAndGet(r.failed());
                return r;
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        List<BatchResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<BatchResult> f : futures) results.add(f.join());
        return results;
    }

    /**
     * Record data as the renderer sees it: padron values, overridden by CSV extras, overridden by derived fields.
     */
    static Map<String, Object> buildData(Map<String, Object> padronRow, InputRecord rec, int pmoSequence, String pmoLabel,
                                         String visitaCode, String barcodePayload, String documentType, LocalDate emissionDate) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (padronRow != null) {
            for (Map.Entry<String, Object> e : padronRow.entrySet()) {
                String key = e.getKey().toLowerCase(Locale.ROOT);
                if (!SchemaManager.SYSTEM_COLUMNS.contains(key)) data.put(key, e.getValue());
            }
        }
        for (Map.Entry<String, String> e : rec.extraFields().entrySet()) {
            data.put(e.getKey(), e.getValue());
        }
        data.put("pmo_sequence", pmoSequence);
        data.put("pmo", pmoLabel);
        data.put("visita_code", visitaCode);
        data.put("barcode_payload", barcodePayload);
        data.put("document_type", documentType);
        data.put("emission_date", emissionDate);
        data.put("account", rec.account());
        data.put("print_order", rec.printOrder());
        return data;
    }

    /** Validates a CSV against the project's padron without rendering or recording anything. */
    public PreprocessResponse preprocess(Long projectId, byte[] csv) {
        checkSize(csv);
        Project project = projectService.require(projectId);
        EmissionCsvLoader.LoadedCsv csvData = csvLoader.load(csv);
        LoadedRun loaded = new LoadedRun(csvData, matchPadron(project, csvData.uniqueAccounts()));
        log.info("[Emission][Preprocess] projectId={} records={} matchedAccounts={} unmatched={}", projectId,
                csvData.records().size(), loaded.matchedAccounts().size(), loaded.unmatchedAccounts().size());
        return new PreprocessResponse(csvData.records().size(), csvData.uniqueAccounts().size(),
                loaded.matchedAccounts().size(), loaded.unmatchedAccounts(), csvData.extraColumns());
    }

    /**
     * Renders one test notice from live padron data. Uses the numbering the next real run would get
     * but records nothing.
     */
    public byte[] renderPreview(Long projectId, Long templateId, String account) throws IOException {
        if (account == null || account.isBlank()) throw new EmissionValidationException("account is required");
        Project project = projectService.require(projectId);
        Template template = templateService.require(templateId);
        if (!project.getId().equals(template.getProjectId())) {
            throw new EmissionValidationException("Template " + templateId + " does not belong to project " + projectId);
        }
        String acc = account.trim();
        Map<String, Object> row = schemaManager.findByAccounts(project.getPadronTable(), List.of(acc)).get(acc);
        if (row == null) throw new EmissionValidationException("Account not found in padron: " + acc);

        int pmoSequence = sequenceResolver.resolvePmoSequence(project.getId());
        String visita = sequenceResolver.visitaTracker(project.getId(), PREVIEW_DOCUMENT_TYPE, List.of(acc)).peek(acc);
        LocalDate today = LocalDate.now(clock);
        String payload = SequenceResolver.barcodePayload(acc, today, visita);
        InputRecord rec = new InputRecord(acc, 1, Map.of(), 0);
        Map<String, Object> data = buildData(row, rec, pmoSequence, SequenceResolver.pmoLabel(pmoSequence),
                visita, payload, PREVIEW_DOCUMENT_TYPE, today);

        List<FieldMapping> fields = templateService.fieldMap(template);
        boolean hasBarcode = fields.stream().anyMatch(FieldMapping::barcode);
        BarcodeImage barcode = hasBarcode ? barcodeGenerator.render(payload, settings.getBarcodeSymbology()) : null;
        log.info("[Emission][Preview] projectId={} templateId={} account={}", projectId, templateId, acc);
        return pdfRenderer.render(fields, template.pageDimensions(), data, barcode);
    }

    private void validateRequest(EmissionRequest request) {
        List<String> problems = new ArrayList<>();
        if (request == null) throw new EmissionValidationException("Emission request is required");
        if (request.projectId() == null) problems.add("projectId is required");
        if (request.templateId() == null) problems.add("templateId is required");
        if (request.documentType() == null || request.documentType().isBlank()) problems.add("documentType is required");
        if (request.emissionDate() == null) problems.add("emissionDate is required");
        if (!problems.isEmpty()) {
            throw new EmissionValidationException(String.join("; ", problems), problems);
        }
    }

    private void checkSize(byte[] csv) {
        if (csv == null || csv.length == 0) throw new EmissionValidationException("CSV file is empty");
        if (csv.length > settings.getMaxCsvSizeBytes()) {
            throw new EmissionValidationException("CSV exceeds the " + settings.getMaxCsvSizeMb() + " MB limit");
        }
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Output directory cannot be created: " + dir, e);
        }
    }

    private EmissionRunSummary cancelled(EmissionRun run, EmissionCsvLoader.LoadedCsv csvData, long t0) {
        run.transition(RunState.CANCELLED);
        EmissionRunSummary summary = summarize(run, null, t0);
        summary.setTotalInputRecords(csvData.records().size());
        summary.setTotalUniqueAccounts(csvData.uniqueAccounts().size());
        finish(run, summary);
        log.info("[Emission][Cancelled] sessionId={}", run.sessionId);
        return summary;
    }

    private void fail(EmissionRun run, String message) {
        if (!run.getState().isTerminal()) run.transition(RunState.FAILED);
        run.failureMessage = message;
    }

    private void finish(EmissionRun run, EmissionRunSummary summary) {
        run.finishedAt = clock.instant();
        run.summary = summary;
    }

    private EmissionRunSummary summarize(EmissionRun run, LoadedRun loaded, long t0) {
        EmissionRunSummary s = new EmissionRunSummary();
        s.setSessionId(run.sessionId);
        s.setState(run.getState().name());
        if (loaded != null) {
            s.setTotalInputRecords(loaded.csv.records().size());
            s.setTotalUniqueAccounts(loaded.csv.uniqueAccounts().size());
            s.setMatchedAndProcessed(loaded.matchedAccounts().size());
            s.setUnmatchedAccounts(new ArrayList<>(loaded.unmatchedAccounts()));
        }
        s.setPdfsGenerated(run.rendered.get());
        s.setFailedRecords(run.failed.get());
        List<String> errors = new ArrayList<>();
        synchronized (run.errors) {
            for (RecordError e : run.errors) {
                if (errors.size() >= settings.getErrorPreviewLimit()) break;
                errors.add(e.toString());
            }
        }
        s.setErrors(errors);
        double elapsed = (System.nanoTime() - t0) / 1_000_000_000.0;
        s.setElapsedSeconds(Math.round(elapsed * 1000.0) / 1000.0);
        s.setThroughputPdfsPerSecond(elapsed > 0 ? Math.round(run.rendered.get() / elapsed * 100.0) / 100.0 : 0.0);
        return s;
    }

    /** CSV records joined with the padron rows found for them. */
    private static final class LoadedRun {
        final EmissionCsvLoader.LoadedCsv csv;
        final Map<String, Map<String, Object>> padron;

        LoadedRun(EmissionCsvLoader.LoadedCsv csv, Map<String, Map<String, Object>> padron) {
            this.csv = csv;
            this.padron = padron;
        }

        List<InputRecord> matchedInPrintOrder() {
            List<InputRecord> out = new ArrayList<>();
            for (InputRecord r : csv.records()) {
                if (padron.containsKey(r.account())) out.add(r);
            }
            out.sort(Comparator.comparingInt(InputRecord::printOrder));
            return out;
        }

        Set<String> matchedAccounts() {
            Set<String> out = new LinkedHashSet<>();
            for (String a : csv.uniqueAccounts()) if (padron.containsKey(a)) out.add(a);
            return out;
        }

        List<String> unmatchedAccounts() {
            List<String> out = new ArrayList<>();
            for (String a : csv.uniqueAccounts()) if (!padron.containsKey(a)) out.add(a);
            return out;
        }
    }
}
