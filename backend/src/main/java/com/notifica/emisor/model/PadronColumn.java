package com.notifica.emisor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A declared padron column as stored in {@code project.padron_schema}.
 */
public record PadronColumn(@JsonProperty("name") String name,
                           @JsonProperty("sql_type") String sqlType,
                           @JsonProperty("required") boolean required,
                           @JsonProperty("unique") boolean unique) {

    public static final String ACCOUNT = "account";
    public static final String DISPLAY_NAME = "display_name";
}
