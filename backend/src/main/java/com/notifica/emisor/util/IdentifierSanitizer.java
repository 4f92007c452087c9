package com.notifica.emisor.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns user-declared names into SQL identifiers safe to splice into DDL/DML.
 * Output only ever contains {@code [a-z0-9_]}, never starts with a digit and
 * never exceeds the PostgreSQL identifier limit.
 */
public final class IdentifierSanitizer {

    public static final int MAX_IDENTIFIER_LENGTH = 63;

    private static final Pattern INVALID = Pattern.compile("[^a-z0-9_]");
    private static final Pattern SAFE = Pattern.compile("^[a-z_][a-z0-9_]{0,62}$");

    private IdentifierSanitizer() {}

    public static String tableName(String name) {
        return sanitize(name, "t_");
    }

    public static String columnName(String name) {
        return sanitize(name, "c_");
    }

    /** True when the identifier is already in sanitized form. */
    public static boolean isSafe(String identifier) {
        return identifier != null && SAFE.matcher(identifier).matches();
    }

    public static String requireSafe(String identifier) {
        if (!isSafe(identifier)) {
            throw new IllegalArgumentException("Unsafe SQL identifier: " + identifier);
        }
        return identifier;
    }

    private static String sanitize(String name, String digitPrefix) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Identifier must not be blank");
        }
        String s = INVALID.matcher(name.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
        if (Character.isDigit(s.charAt(0))) {
            s = digitPrefix + s;
        }
        return s.length() > MAX_IDENTIFIER_LENGTH ? s.substring(0, MAX_IDENTIFIER_LENGTH) : s;
    }
}
