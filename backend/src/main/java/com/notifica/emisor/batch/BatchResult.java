package com.notifica.emisor.batch;

import com.notifica.emisor.dto.RecordError;

import java.util.ArrayList;
import java.util.List;

public record BatchResult(int rendered, int failed, List<RecordError> errors) {

    /** Used when a whole batch blew up outside the per-record handling. */
    public static BatchResult failedBatch(List<EmissionJob> jobs, Throwable cause) {
        List<RecordError> errors = new ArrayList<>();
        String message = "Batch failed: " + (cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage());
        for (EmissionJob job : jobs) {
            errors.add(new RecordError(job.account(), job.printOrder(), message));
        }
        return new BatchResult(0, jobs.size(), errors);
    }
}
