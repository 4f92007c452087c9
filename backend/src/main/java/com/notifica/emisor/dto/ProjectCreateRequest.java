package com.notifica.emisor.dto;

import com.notifica.emisor.model.PadronColumn;

import java.util.List;

public record ProjectCreateRequest(String name, String description, List<PadronColumn> columns) {
}
