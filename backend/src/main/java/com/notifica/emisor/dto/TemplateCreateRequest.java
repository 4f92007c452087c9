package com.notifica.emisor.dto;

import com.notifica.emisor.model.FieldMapping;

import java.util.List;

/** Page size defaults to Mexico Oficio when omitted. Field entries are drawn in list order. */
public record TemplateCreateRequest(String name, String description, Double pageWidthCm, Double pageHeightCm,
                                    List<FieldMapping> fieldMap) {
}
