package com.notifica.emisor.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
public class EmissionSettings {

    @Value("${emisor.output.root:./output}")
    private String outputRoot;

    @Value("${emisor.emission.batch-size:100}")
    private int batchSize;

    @Value("${emisor.emission.max-csv-size-mb:50}")
    private long maxCsvSizeMb;

    @Value("${emisor.emission.error-preview-limit:10}")
    private int errorPreviewLimit;

    @Value("${emisor.emission.unmatched-report:true}")
    private boolean unmatchedReport;

    @Value("${emisor.barcode.symbology:code128}")
    private String barcodeSymbology;

    public EmissionSettings() {
    }

    public EmissionSettings(String outputRoot, int batchSize, long maxCsvSizeMb, int errorPreviewLimit,
                            boolean unmatchedReport, String barcodeSymbology) {
        this.outputRoot = outputRoot;
        this.batchSize = batchSize;
        this.maxCsvSizeMb = maxCsvSizeMb;
        this.errorPreviewLimit = errorPreviewLimit;
        this.unmatchedReport = unmatchedReport;
        this.barcodeSymbology = barcodeSymbology;
    }

    public Path getOutputRoot() { return Path.of(outputRoot); }
    public int getBatchSize() { return batchSize > 0 ? batchSize : 100; }
    public long getMaxCsvSizeBytes() { return maxCsvSizeMb * 1024L * 1024L; }
    public long getMaxCsvSizeMb() { return maxCsvSizeMb; }
    public int getErrorPreviewLimit() { return errorPreviewLimit; }
    public boolean isUnmatchedReport() { return unmatchedReport; }
    public String getBarcodeSymbology() { return barcodeSymbology; }
}
