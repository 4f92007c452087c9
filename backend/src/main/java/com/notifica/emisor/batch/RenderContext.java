package com.notifica.emisor.batch;

import com.notifica.emisor.model.FieldMapping;
import com.notifica.emisor.model.PageDimensions;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

/** Run-wide values shared by every batch of one emission. */
public record RenderContext(String sessionId,
                            Long projectId,
                            Long templateId,
                            String documentType,
                            String pmoLabel,
                            LocalDate emissionDate,
                            List<FieldMapping> fields,
                            PageDimensions page,
                            String symbology,
                            Path outputDir) {

    public boolean hasBarcodeField() {
        return fields.stream().anyMatch(FieldMapping::barcode);
    }
}
