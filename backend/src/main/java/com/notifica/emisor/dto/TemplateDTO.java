package com.notifica.emisor.dto;

import com.notifica.emisor.model.FieldMapping;

import java.util.List;

public record TemplateDTO(Long id, Long projectId, String name, String description,
                          double pageWidthCm, double pageHeightCm, List<FieldMapping> fieldMap) {
}
