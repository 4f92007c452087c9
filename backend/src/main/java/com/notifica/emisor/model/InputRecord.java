package com.notifica.emisor.model;

import java.util.Map;

/** One data row of an emission CSV; {@code csvLine} is the 1-based physical line for error messages. */
public record InputRecord(String account, int printOrder, Map<String, String> extraFields, long csvLine) {
}
