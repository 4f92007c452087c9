package com.notifica.emisor.service;

import com.notifica.emisor.model.InputRecord;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class EmissionCsvLoaderTest {

    private final EmissionCsvLoader loader = new EmissionCsvLoader();

    private static byte[] csv(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void spanishAliasesAndExtraColumnsAreRecognized() {
        EmissionCsvLoader.LoadedCsv loaded = loader.load(csv("cuenta,orden_impresion,Monto\nA1,2,100\nA2,1,200\n"));

        assertThat(loaded.records()).hasSize(2);
        assertThat(loaded.extraColumns()).containsExactly("monto");
        InputRecord first = loaded.records().get(0);
        assertThat(first.account()).isEqualTo("A1");
        assertThat(first.printOrder()).isEqualTo(2);
        assertThat(first.extraFields()).containsEntry("monto", "100");
        assertThat(first.csvLine()).isEqualTo(2);
    }

    @Test
    void utf8BomIsIgnored() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(new byte[]{(byte) 0xEF, (byte) 0xBB, (byte) 0xBF});
        out.write(csv("account,print_order\nCTA-Ñ01,1\n"));

        EmissionCsvLoader.LoadedCsv loaded = loader.load(out.toByteArray());

        assertThat(loaded.records()).extracting(InputRecord::account).containsExactly("CTA-Ñ01");
    }

    @Test
    void uniqueAccountsKeepFirstSeenOrder() {
        EmissionCsvLoader.LoadedCsv loaded = loader.load(csv("account,print_order\nB,1\nA,2\nB,3\n"));
        assertThat(loaded.uniqueAccounts()).containsExactly("B", "A");
        assertThat(loaded.records()).hasSize(3);
    }

    @Test
    void allRecordProblemsAreReportedTogether() {
        EmissionValidationException ex = catchThrowableOfType(
                () -> loader.load(csv("account,print_order\n,1\nB,x\nC,1\nD,4\n")),
                EmissionValidationException.class);

        assertThat(ex.getMessage()).isEqualTo("CSV has 3 invalid record(s)");
        assertThat(ex.getProblems()).containsExactly(
                "line 2: account is empty",
                "line 3: print_order is not an integer: 'x'",
                "line 4: print_order 1 already used on line 2");
    }

    @Test
    void missingRequiredColumnsRejected() {
        assertThatThrownBy(() -> loader.load(csv("foo,bar\n1,2\n")))
                .isInstanceOf(EmissionValidationException.class)
                .hasMessageContaining("missing required columns")
                .hasMessageContaining("account/cuenta")
                .hasMessageContaining("print_order/orden_impresion");
    }

    @Test
    void headerWithoutRecordsRejected() {
        assertThatThrownBy(() -> loader.load(csv("account,print_order\n")))
                .isInstanceOf(EmissionValidationException.class)
                .hasMessage("CSV has no data records");
    }

    @Test
    void emptyInputRejected() {
        assertThatThrownBy(() -> loader.load(new byte[0]))
                .isInstanceOf(EmissionValidationException.class)
                .hasMessage("CSV file is empty");
    }

    @Test
    void aliasCollidingWithCanonicalNameRejected() {
        assertThatThrownBy(() -> loader.load(csv("account,cuenta,print_order\nA,A,1\n")))
                .isInstanceOf(EmissionValidationException.class)
                .hasMessageContaining("repeats column 'account'");
    }

    @Test
    void unterminatedQuoteIsAValidationError() {
        assertThatThrownBy(() -> loader.load(csv("cuenta,orden_impresion\nA1,1\n\"A2,2\n")))
                .isInstanceOf(EmissionValidationException.class)
                .hasMessageStartingWith("CSV could not be parsed");
    }

    @Test
    void identicalHeaderNamesAreAValidationError() {
        assertThatThrownBy(() -> loader.load(csv("account,account,print_order\nA,A,1\n")))
                .isInstanceOf(EmissionValidationException.class)
                .hasMessageStartingWith("CSV could not be parsed");
    }
}
