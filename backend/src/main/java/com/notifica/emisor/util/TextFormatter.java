package com.notifica.emisor.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Value to display-string formatting shared by the padron loader and the PDF renderer.
 * <p>
 * {@link #format(Object, String)} never throws: anything it cannot interpret is handed
 * back as {@code String.valueOf(value)} so a bad cell never aborts a batch.
 */
public class TextFormatter {

    private static final Pattern DECIMAL_SPEC = Pattern.compile("decimal\\s*\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\)");

    private static final List<DateTimeFormatter> DATE_INPUTS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy"),
            DateTimeFormatter.ofPattern("dd-MM-yyyy"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd"),
            DateTimeFormatter.ofPattern("ddMMyyyy")
    );

    private static final List<DateTimeFormatter> DATE_TIME_INPUTS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm")
    );

    private final FormatSettings settings;
    private final DateTimeFormatter dateOutput;

    public TextFormatter(FormatSettings settings) {
        this.settings = settings != null ? settings : FormatSettings.defaults();
        this.dateOutput = DateTimeFormatter.ofPattern(this.settings.datePattern());
    }

    public FormatSettings getSettings() { return settings; }

    public String format(Object value) {
        return format(value, null);
    }

    public String format(Object value, String formatSpec) {
        if (value == null) return "";
        try {
            if (formatSpec == null || formatSpec.isBlank()) {
                return autoFormat(value);
            }
            String spec = formatSpec.trim();
            String lower = spec.toLowerCase(Locale.ROOT);
            if (lower.contains("moneda") || lower.contains("currency") || lower.contains("$")) {
                return formatCurrency(value);
            }
            if (lower.contains("fecha") || lower.contains("date")) {
                return formatDate(value);
            }
            if (lower.contains("entero") || lower.contains("integer")) {
                return formatInteger(value);
            }
            if (lower.contains("decimal") || lower.contains("número") || lower.contains("numero") || lower.contains("number")) {
                return formatDecimal(value, lower);
            }
            if (lower.contains("mayúsculas") || lower.contains("mayusculas") || lower.contains("uppercase")) {
                return String.valueOf(value).toUpperCase(Locale.ROOT);
            }
            if (lower.contains("minúsculas") || lower.contains("minusculas") || lower.contains("lowercase")) {
                return String.valueOf(value).toLowerCase(Locale.ROOT);
            }
            if (lower.contains("capitalize") || lower.contains("title")) {
                return titleCase(String.valueOf(value));
            }
            if (spec.indexOf('#') >= 0) {
                return applyMask(value, spec);
            }
            if (spec.contains("{value}")) {
                return spec.replace("{value}", autoFormat(value));
            }
            return autoFormat(value);
        } catch (RuntimeException e) {
            return String.valueOf(value);
        }
    }

    private String autoFormat(Object value) {
        if (value instanceof Number n) {
            BigDecimal d = toDecimal(n);
            if (d == null) return String.valueOf(value);
            return isIntegral(d) ? grouped(d, 0) : grouped(d, 2);
        }
        LocalDate date = toLocalDate(value);
        if (date != null) return date.format(dateOutput);
        return String.valueOf(value);
    }

    private String formatCurrency(Object value) {
        BigDecimal d = toDecimal(value);
        if (d == null) return String.valueOf(value);
        String body = grouped(d.abs(), 2);
        return (d.signum() < 0 ? "-" : "") + settings.currencySymbol() + body;
    }

    private String formatDate(Object value) {
        LocalDate date = toLocalDate(value);
        if (date == null && value instanceof CharSequence cs) {
            date = parseDate(cs.toString());
        }
        return date == null ? String.valueOf(value) : date.format(dateOutput);
    }

    private String formatInteger(Object value) {
        BigDecimal d = toDecimal(value);
        if (d == null) return String.valueOf(value);
        return grouped(d.setScale(0, RoundingMode.HALF_UP), 0);
    }

    private String formatDecimal(Object value, String lowerSpec) {
        BigDecimal d = toDecimal(value);
        if (d == null) return String.valueOf(value);
        Matcher m = DECIMAL_SPEC.matcher(lowerSpec);
        int scale = m.find() ? Integer.parseInt(m.group(2)) : 2;
        return grouped(d, scale);
    }

    private String applyMask(Object value, String mask) {
        String raw = value instanceof BigDecimal bd ? bd.toPlainString() : String.valueOf(value);
        String digits = raw.replaceAll("\\D", "");
        if (digits.isEmpty()) return String.valueOf(value);
        StringBuilder out = new StringBuilder(mask.length());
        int di = 0;
        for (int i = 0; i < mask.length() && di < digits.length(); i++) {
            char c = mask.charAt(i);
            if (c == '#') {
                out.append(digits.charAt(di++));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static String titleCase(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean startOfWord = true;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                sb.append(c);
                startOfWord = true;
            }
        }
        return sb.toString();
    }

    private String grouped(BigDecimal d, int scale) {
        DecimalFormatSymbols symbols = new DecimalFormatSymbols(Locale.ROOT);
        symbols.setGroupingSeparator(settings.thousandsSeparator());
        symbols.setDecimalSeparator(settings.decimalSeparator());
        symbols.setMinusSign('-');
        String pattern = scale > 0 ? "#,##0." + "0".repeat(scale) : "#,##0";
        DecimalFormat df = new DecimalFormat(pattern, symbols);
        df.setRoundingMode(RoundingMode.HALF_UP);
        return df.format(d);
    }

    private static boolean isIntegral(BigDecimal d) {
        return d.signum() == 0 || d.stripTrailingZeros().scale() <= 0;
    }

    private BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal bd) return bd;
        if (value instanceof Double || value instanceof Float) {
            double dv = ((Number) value).doubleValue();
            if (Double.isNaN(dv) || Double.isInfinite(dv)) return null;
            return BigDecimal.valueOf(dv);
        }
        if (value instanceof Number n) return new BigDecimal(n.toString());
        if (value instanceof CharSequence cs) return parseNumber(cs.toString());
        return null;
    }

    private static LocalDate toLocalDate(Object value) {
        if (value instanceof LocalDate d) return d;
        if (value instanceof LocalDateTime dt) return dt.toLocalDate();
        if (value instanceof OffsetDateTime odt) return odt.toLocalDate();
        if (value instanceof ZonedDateTime zdt) return zdt.toLocalDate();
        if (value instanceof Instant i) return i.atZone(ZoneId.systemDefault()).toLocalDate();
        if (value instanceof java.sql.Date sd) return sd.toLocalDate();
        if (value instanceof java.sql.Timestamp ts) return ts.toLocalDateTime().toLocalDate();
        if (value instanceof java.util.Date ud) return ud.toInstant().atZone(ZoneId.systemDefault()).toLocalDate();
        if (value instanceof TemporalAccessor ta) {
            try { return LocalDate.from(ta); } catch (DateTimeException ignored) { return null; }
        }
        return null;
    }

    /**
     * Lenient number parsing for CSV cells: strips the currency symbol and blanks, then
     * decides which separator is the decimal one. Returns null when nothing numeric is left.
     */
    public BigDecimal parseNumber(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        if (!settings.currencySymbol().isEmpty()) s = s.replace(settings.currencySymbol(), "");
        s = s.replaceAll("[\\s\\u00A0]", "");
        if (s.isEmpty()) return null;
        int lastDot = s.lastIndexOf('.');
        int lastComma = s.lastIndexOf(',');
        String normalized;
        if (lastDot >= 0 && lastComma >= 0) {
            char decimal = lastDot > lastComma ? '.' : ',';
            char grouping = decimal == '.' ? ',' : '.';
            normalized = s.replace(String.valueOf(grouping), "").replace(decimal, '.');
        } else if (lastDot >= 0 || lastComma >= 0) {
            char sep = lastDot >= 0 ? '.' : ',';
            int count = s.length() - s.replace(String.valueOf(sep), "").length();
            int digitsAfter = s.length() - s.lastIndexOf(sep) - 1;
            boolean grouping = count > 1 || (sep == settings.thousandsSeparator() && digitsAfter == 3);
            normalized = grouping ? s.replace(String.valueOf(sep), "") : s.replace(sep, '.');
        } else {
            normalized = s;
        }
        try {
            return new BigDecimal(normalized);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Accepts the usual padron date spellings; null when none matches. */
    public LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String t = raw.trim();
        for (DateTimeFormatter f : DATE_INPUTS) {
            try { return LocalDate.parse(t, f); } catch (DateTimeParseException ignored) { /* next pattern */ }
        }
        for (DateTimeFormatter f : DATE_TIME_INPUTS) {
            try { return LocalDateTime.parse(t, f).toLocalDate(); } catch (DateTimeParseException ignored) { /* next pattern */ }
        }
        return null;
    }
}
