package com.notifica.emisor.dto;

import java.time.Instant;

public record RunStatusDTO(String sessionId, String state, int total, int rendered, int failed,
                           boolean cancelRequested, Instant startedAt, Instant finishedAt,
                           String failureMessage, EmissionRunSummary summary) {
}
