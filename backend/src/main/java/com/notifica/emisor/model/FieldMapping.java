package com.notifica.emisor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Placement of one data field on the page, in centimeters from the top-left corner.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldMapping(@JsonProperty("padron_field") String padronField,
                           @JsonProperty("x") double x,
                           @JsonProperty("y") double y,
                           @JsonProperty("width") double width,
                           @JsonProperty("height") double height,
                           @JsonProperty("font") String font,
                           @JsonProperty("size") float size,
                           @JsonProperty("is_barcode") boolean barcode,
                           @JsonProperty("format_spec") String formatSpec) {

    public static final float DEFAULT_FONT_SIZE = 10f;

    public FieldMapping {
        if (font == null || font.isBlank()) font = "Helvetica";
        if (size <= 0) size = DEFAULT_FONT_SIZE;
    }

    /** Placeholder drawn when the record carries no value (or no barcode image) for this field. */
    public String placeholder() {
        return "[" + padronField + "]";
    }
}
