package com.notifica.emisor.dto;

import java.time.LocalDate;

/**
 * Parameters of one emission run. {@code pmoLabel} is optional; without it the label becomes
 * {@code "PMO <sequence>"}.
 */
public record EmissionRequest(Long projectId,
                              Long templateId,
                              String documentType,
                              String pmoLabel,
                              LocalDate emissionDate,
                              String requestedBy,
                              String sourceFilename) {
}
