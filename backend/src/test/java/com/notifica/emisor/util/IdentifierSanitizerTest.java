package com.notifica.emisor.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentifierSanitizerTest {

    @Test
    void columnNameLowercasesAndReplacesInvalidCharacters() {
        assertThat(IdentifierSanitizer.columnName("Fecha Vencimiento")).isEqualTo("fecha_vencimiento");
        assertThat(IdentifierSanitizer.columnName("  Año ")).isEqualTo("a_o");
        assertThat(IdentifierSanitizer.columnName("monto-total")).isEqualTo("monto_total");
    }

    @Test
    void leadingDigitGetsPrefixed() {
        assertThat(IdentifierSanitizer.columnName("1er_pago")).isEqualTo("c_1er_pago");
        assertThat(IdentifierSanitizer.tableName("9lives")).isEqualTo("t_9lives");
    }

    @Test
    void longNamesAreCutToPostgresLimit() {
        String name = "a".repeat(100);
        assertThat(IdentifierSanitizer.columnName(name)).hasSize(IdentifierSanitizer.MAX_IDENTIFIER_LENGTH);
    }

    @Test
    void blankNameRejected() {
        assertThatThrownBy(() -> IdentifierSanitizer.columnName("  "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IdentifierSanitizer.tableName(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void requireSafeRejectsInjectionAttempts() {
        assertThat(IdentifierSanitizer.isSafe("padron_0123456789ab")).isTrue();
        assertThat(IdentifierSanitizer.isSafe("x; drop table project")).isFalse();
        assertThat(IdentifierSanitizer.isSafe("Upper")).isFalse();
        assertThatThrownBy(() -> IdentifierSanitizer.requireSafe("a\"b"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsafe SQL identifier");
    }
}
