package com.notifica.emisor.dto;

public record ColumnDescription(String name, String dataType, boolean nullable) {
}
