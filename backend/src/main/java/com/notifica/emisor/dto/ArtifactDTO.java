package com.notifica.emisor.dto;

import java.time.Instant;

public record ArtifactDTO(String account, int printOrder, String visitaCode, String barcodePayload,
                          String filePath, Long fileSize, String sha256Hash, String renderedBy,
                          Instant renderedAt, String error) {
}
