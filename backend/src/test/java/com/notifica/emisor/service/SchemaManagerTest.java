package com.notifica.emisor.service;

import com.notifica.emisor.dto.ColumnDescription;
import com.notifica.emisor.dto.PadronLoadResult;
import com.notifica.emisor.model.PadronColumn;
import com.notifica.emisor.util.FormatSettings;
import com.notifica.emisor.util.TextFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class SchemaManagerTest {

    private static final String PROJECT_UUID = "123e4567-e89b-12d3-a456-426614174000";
    private static final String TABLE = "padron_123e4567e89b";

    private DriverManagerDataSource ds;
    private SchemaManager schemaManager;
    private List<PadronColumn> schema;

    @BeforeEach
    void setUp() {
        ds = new DriverManagerDataSource(
                "jdbc:h2:mem:schema_" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1", "sa", "");
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
        schemaManager = new SchemaManager(new NamedParameterJdbcTemplate(ds), new TextFormatter(FormatSettings.defaults()), clock);
        schema = schemaManager.normalizeColumns(List.of(
                new PadronColumn("Account", "varchar(50)", false, false),
                new PadronColumn("display_name", "text", true, false),
                new PadronColumn("monto", "numeric(12,2)", false, false),
                new PadronColumn("vence", "date", false, false),
                new PadronColumn("activo", "bool", false, false)
        ));
    }

    private static InputStream csv(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void tableNameDerivesFromProjectUuid() {
        assertThat(SchemaManager.tableNameFor(PROJECT_UUID)).isEqualTo(TABLE);
        assertThatThrownBy(() -> SchemaManager.tableNameFor("not-a-uuid")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void normalizeForcesAccountRequiredAndUnique() {
        PadronColumn account = schema.get(0);
        assertThat(account.name()).isEqualTo("account");
        assertThat(account.sqlType()).isEqualTo("VARCHAR(50)");
        assertThat(account.required()).isTrue();
        assertThat(account.unique()).isTrue();
        assertThat(schema.get(4).sqlType()).isEqualTo("BOOLEAN");
    }

    @Test
    void normalizeRejectsBadSchemas() {
        assertThatThrownBy(() -> schemaManager.normalizeColumns(List.of(
                new PadronColumn("account", "text", true, true),
                new PadronColumn("id", "integer", false, false))))
                .hasMessageContaining("reserved");
        assertThatThrownBy(() -> schemaManager.normalizeColumns(List.of(
                new PadronColumn("account", "text", true, true))))
                .hasMessageContaining("display_name");
        assertThatThrownBy(() -> schemaManager.normalizeColumns(List.of(
                new PadronColumn("account", "integer", true, true),
                new PadronColumn("display_name", "text", true, false))))
                .hasMessageContaining("text type");
        assertThatThrownBy(() -> schemaManager.normalizeColumns(List.of(
                new PadronColumn("account", "text", true, true),
                new PadronColumn("display_name", "text", true, false),
                new PadronColumn("Display Name", "text", false, false))))
                .hasMessageContaining("Duplicate column");
    }

    @Test
    void sqlTypesAreAllowListed() {
        assertThat(SchemaManager.normalizeSqlType("character varying ( 20 )")).isEqualTo("VARCHAR(20)");
        assertThat(SchemaManager.normalizeSqlType("decimal(10,2)")).isEqualTo("DECIMAL(10,2)");
        assertThat(SchemaManager.normalizeSqlType("numeric")).isEqualTo("NUMERIC");
        assertThat(SchemaManager.normalizeSqlType("int")).isEqualTo("INTEGER");
        assertThatThrownBy(() -> SchemaManager.normalizeSqlType("json")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SchemaManager.normalizeSqlType("text; drop table project")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void createDescribeAndDropTable() {
        String table = schemaManager.createTable(PROJECT_UUID, schema);
        assertThat(table).isEqualTo(TABLE);
        assertThat(schemaManager.tableExists(TABLE)).isTrue();

        List<ColumnDescription> columns = schemaManager.describe(TABLE);
        assertThat(columns).extracting(ColumnDescription::name)
                .containsExactly("account", "display_name", "monto", "vence", "activo");
        assertThat(columns.get(0).nullable()).isFalse();
        assertThat(columns.get(2).nullable()).isTrue();

        assertThatThrownBy(() -> schemaManager.createTable(PROJECT_UUID, schema)).isInstanceOf(IllegalStateException.class);

        assertThat(schemaManager.dropTable(TABLE)).isTrue();
        assertThat(schemaManager.tableExists(TABLE)).isFalse();
        assertThat(schemaManager.dropTable("bad;name")).isFalse();
    }

    @Test
    void loadConvertsValuesAndHonorsMergeFlag() throws Exception {
        schemaManager.createTable(PROJECT_UUID, schema);
        String content = "cuenta,nombre,monto,vence,activo\n"
                + "A1,Juan Perez,\"1.500,50\",05/03/2024,si\n"
                + "A2,Ana Lopez,200,2024-04-01,no\n";

        PadronLoadResult first = schemaManager.loadCsv(TABLE, schema, csv(content), false);
        assertThat(first).isEqualTo(new PadronLoadResult(2, 0, 0));

        Map<String, Map<String, Object>> rows = schemaManager.findByAccounts(TABLE, List.of("A1", "A2", "ZZ"));
        assertThat(rows).containsOnlyKeys("A1", "A2");
        assertThat((BigDecimal) rows.get("A1").get("monto")).isEqualByComparingTo("1500.50");
        assertThat(String.valueOf(rows.get("A1").get("vence"))).isEqualTo("2024-03-05");
        assertThat(rows.get("A2").get("activo")).isEqualTo(Boolean.FALSE);

        PadronLoadResult again = schemaManager.loadCsv(TABLE, schema, csv(content), false);
        assertThat(again).isEqualTo(new PadronLoadResult(0, 0, 2));

        String changed = "account,display_name\nA1,Juan P. Perez\nA3,Nuevo\n";
        PadronLoadResult merged = schemaManager.loadCsv(TABLE, schema, csv(changed), true);
        assertThat(merged).isEqualTo(new PadronLoadResult(1, 1, 0));
        assertThat(schemaManager.findByAccounts(TABLE, List.of("A1")).get("A1").get("display_name")).isEqualTo("Juan P. Perez");
    }

    @Test
    void failingRowStopsLoadAndReportsPartialCounts() {
        schemaManager.createTable(PROJECT_UUID, schema);
        String content = "account,display_name,monto\nB1,Bea,10\nB2,,20\nB3,Beto,30\n";

        PadronLoadException ex = catchThrowableOfType(
                () -> schemaManager.loadCsv(TABLE, schema, csv(content), false), PadronLoadException.class);

        assertThat(ex.getRowNumber()).isEqualTo(2);
        assertThat(ex.getInserted()).isEqualTo(1);
        assertThat(ex.getMessage()).contains("display_name");
        assertThat(schemaManager.findByAccounts(TABLE, List.of("B1", "B3"))).containsOnlyKeys("B1");
    }

    @Test
    void invalidNumberStopsLoad() {
        schemaManager.createTable(PROJECT_UUID, schema);
        assertThatThrownBy(() -> schemaManager.loadCsv(TABLE, schema, csv("account,display_name,monto\nC1,Carla,mucho\n"), false))
                .isInstanceOf(PadronLoadException.class)
                .hasMessageContaining("Invalid number for monto");
    }

    @Test
    void headerMustStayInsideDeclaredSchema() {
        schemaManager.createTable(PROJECT_UUID, schema);
        assertThatThrownBy(() -> schemaManager.loadCsv(TABLE, schema, csv("account,display_name,telefono\nD1,Dora,555\n"), false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("telefono");
        assertThatThrownBy(() -> schemaManager.loadCsv(TABLE, schema, csv("\uFEFFaccount,monto\nD1,1\n"), false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'account' and 'display_name'");
    }

    @Test
    void sampleLimitIsClamped() throws Exception {
        schemaManager.createTable(PROJECT_UUID, schema);
        schemaManager.loadCsv(TABLE, schema, csv("account,display_name\nE1,Uno\nE2,Dos\nE3,Tres\n"), false);

        assertThat(schemaManager.sampleRows(TABLE, 0)).hasSize(1);
        assertThat(schemaManager.sampleRows(TABLE, 1000)).hasSize(3);
        assertThat(schemaManager.sampleRows(TABLE, 2)).extracting(r -> r.get("account")).containsExactly("E1", "E2");
    }

    @Test
    void mergingIdenticalContentTwiceKeepsRowCountAndAdvancesUpdatedAt() throws Exception {
        SchemaManager ticking = new SchemaManager(new NamedParameterJdbcTemplate(ds),
                new TextFormatter(FormatSettings.defaults()), new TickingClock(Instant.parse("2024-06-01T12:00:00Z")));
        ticking.createTable(PROJECT_UUID, schema);
        String content = "account,display_name,monto\nF1,Fer,10\nF2,Fabi,20\n";
        JdbcTemplate jdbc = new JdbcTemplate(ds);

        assertThat(ticking.loadCsv(TABLE, schema, csv(content), true)).isEqualTo(new PadronLoadResult(2, 0, 0));
        Timestamp firstUpdate = jdbc.queryForObject("SELECT updated_at FROM " + TABLE + " WHERE account = 'F1'", Timestamp.class);

        assertThat(ticking.loadCsv(TABLE, schema, csv(content), true)).isEqualTo(new PadronLoadResult(0, 2, 0));
        Timestamp secondUpdate = jdbc.queryForObject("SELECT updated_at FROM " + TABLE + " WHERE account = 'F1'", Timestamp.class);

        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM " + TABLE, Integer.class)).isEqualTo(2);
        assertThat(secondUpdate).isAfter(firstUpdate);
    }

    @Test
    void inferredTypesFollowColumnValues() throws Exception {
        String content = "cuenta,nombre,lote,monto,vence,folio,poblacion\n"
                + "00123,Juan Perez,12,\"1.500,50\",05/03/2024,0045,3000000000\n"
                + "A-77,Ana,7,200,2024-04-01,0046,12\n"
                + "B-1,Beto,,,,0047,\n";

        SchemaManager.InferredPadron inferred = schemaManager.inferFromCsv(csv(content), true);

        assertThat(inferred.columns()).extracting(PadronColumn::name)
                .containsExactly("account", "display_name", "lote", "monto", "vence", "folio", "poblacion");
        assertThat(inferred.columns()).extracting(PadronColumn::sqlType)
                .containsExactly("VARCHAR(10)", "VARCHAR(20)", "INTEGER", "DECIMAL(10,2)", "DATE", "VARCHAR(8)", "BIGINT");
        PadronColumn account = inferred.columns().get(0);
        assertThat(account.required()).isTrue();
        assertThat(account.unique()).isTrue();
        assertThat(inferred.columns().get(1).required()).isTrue();
        assertThat(inferred.columns().get(2).required()).isFalse();
        assertThat(inferred.rows()).hasSize(3);
        assertThat(inferred.rows().get(0)).containsEntry("account", "00123").containsEntry("monto", "1.500,50");
    }

    @Test
    void accountStaysTextEvenWhenNumericAndDetectionCanBeTurnedOff() throws Exception {
        String content = "cuenta,nombre,monto\n1001,Uno,5\n1002,Dos,6\n";

        assertThat(schemaManager.inferFromCsv(csv(content), true).columns())
                .extracting(PadronColumn::sqlType).containsExactly("VARCHAR(8)", "VARCHAR(6)", "INTEGER");
        assertThat(schemaManager.inferFromCsv(csv(content), false).columns())
                .extracting(PadronColumn::sqlType).containsOnly("VARCHAR(255)");
    }

    @Test
    void inferredSchemaCreatesTableAndLoadsRows() throws Exception {
        String content = "\uFEFFCuenta,Nombre,Monto\nG1,Gil,\"1.234,50\"\nG2,Gaby,99\n";
        SchemaManager.InferredPadron inferred = schemaManager.inferFromCsv(csv(content), true);
        List<PadronColumn> normalized = schemaManager.normalizeColumns(inferred.columns());

        schemaManager.createTable(PROJECT_UUID, normalized);
        PadronLoadResult result = schemaManager.loadRows(TABLE, normalized, inferred.rows(), false);

        assertThat(result).isEqualTo(new PadronLoadResult(2, 0, 0));
        Map<String, Object> row = schemaManager.findByAccounts(TABLE, List.of("G1")).get("G1");
        assertThat(row.get("display_name")).isEqualTo("Gil");
        assertThat((BigDecimal) row.get("monto")).isEqualByComparingTo("1234.50");
    }

    @Test
    void inferenceRejectsCsvWithoutMandatoryColumns() {
        assertThatThrownBy(() -> schemaManager.inferFromCsv(csv("nombre,monto\nAna,1\n"), true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'cuenta'");
        assertThatThrownBy(() -> schemaManager.inferFromCsv(csv("cuenta,monto\nA1,1\n"), true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'nombre'");
        assertThatThrownBy(() -> schemaManager.inferFromCsv(csv("cuenta,nombre\n"), true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Padron CSV has no data rows");
        assertThatThrownBy(() -> schemaManager.inferFromCsv(csv("cuenta,nombre\nA1,\"Ana\n"), true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Padron CSV could not be parsed");
    }

    /** Advances one second on every read. */
    private static final class TickingClock extends Clock {
        private Instant current;

        TickingClock(Instant start) {
            this.current = start;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public synchronized Instant instant() {
            current = current.plusSeconds(1);
            return current;
        }
    }
}
