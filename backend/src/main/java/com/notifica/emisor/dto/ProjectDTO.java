package com.notifica.emisor.dto;

import com.notifica.emisor.model.PadronColumn;

import java.time.Instant;
import java.util.List;

public record ProjectDTO(Long id, String uuid, String name, String description, String padronTable,
                         List<PadronColumn> columns, Instant createdAt) {
}
