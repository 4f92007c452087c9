package com.notifica.emisor.util;

/**
 * Locale-like knobs for {@link TextFormatter}. Passed explicitly instead of living
 * in process-wide state so two formatters with different conventions can coexist.
 */
public record FormatSettings(String currencySymbol,
                             char thousandsSeparator,
                             char decimalSeparator,
                             String datePattern) {

    public static FormatSettings defaults() {
        return new FormatSettings("$", '.', ',', "dd/MM/yyyy");
    }

    public FormatSettings {
        if (currencySymbol == null) currencySymbol = "";
        if (datePattern == null || datePattern.isBlank()) datePattern = "dd/MM/yyyy";
        if (thousandsSeparator == decimalSeparator) {
            throw new IllegalArgumentException("Thousands and decimal separators must differ");
        }
    }
}
