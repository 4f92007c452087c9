package com.notifica.emisor.service;

import com.notifica.emisor.dto.ColumnDescription;
import com.notifica.emisor.dto.PadronLoadResult;
import com.notifica.emisor.model.PadronColumn;
import com.notifica.emisor.util.IdentifierSanitizer;
import com.notifica.emisor.util.TextFormatter;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Types;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Owns the per-project padron tables. Every identifier that reaches SQL text has gone through
 * {@link IdentifierSanitizer} and every value is bound as a parameter.
 * <p>
 * Loads are row-by-row without a spanning transaction: a failing row stops the load and the rows
 * before it stay applied.
 */
@Service
public class SchemaManager {
    private static final Logger log = LoggerFactory.getLogger(SchemaManager.class);

    public static final Set<String> SYSTEM_COLUMNS = Set.of("id", "created_at", "updated_at", "is_deleted");
    public static final int MAX_SAMPLE = 100;
    private static final int IN_CHUNK = 500;

    private static final Map<String, String> HEADER_ALIASES = Map.of(
            "cuenta", PadronColumn.ACCOUNT,
            "nombre", PadronColumn.DISPLAY_NAME
    );

    private static final Pattern SIZED_CHAR = Pattern.compile("^(VARCHAR|CHARACTER VARYING|CHAR|CHARACTER)\\s*\\(\\s*(\\d{1,7})\\s*\\)$");
    private static final Pattern NUMERIC = Pattern.compile("^(NUMERIC|DECIMAL)(\\s*\\(\\s*(\\d{1,4})\\s*(,\\s*(\\d{1,4})\\s*)?\\))?$");
    private static final Map<String, String> PLAIN_TYPES = Map.ofEntries(
            Map.entry("TEXT", "TEXT"),
            Map.entry("INTEGER", "INTEGER"),
            Map.entry("INT", "INTEGER"),
            Map.entry("BIGINT", "BIGINT"),
            Map.entry("SMALLINT", "SMALLINT"),
            Map.entry("REAL", "REAL"),
            Map.entry("DOUBLE PRECISION", "DOUBLE PRECISION"),
            Map.entry("BOOLEAN", "BOOLEAN"),
            Map.entry("BOOL", "BOOLEAN"),
            Map.entry("DATE", "DATE"),
            Map.entry("TIMESTAMP", "TIMESTAMP")
    );

    static final int MAX_INFERRED_VARCHAR = 255;
    private static final Pattern PLAIN_INTEGER = Pattern.compile("^[+-]?\\d+$");

    private static final Set<String> TRUE_WORDS = Set.of("true", "t", "1", "yes", "y", "si", "sí", "s");
    private static final Set<String> FALSE_WORDS = Set.of("false", "f", "0", "no", "n");

    private final NamedParameterJdbcTemplate jdbc;
    private final TextFormatter formatter;
    private final Clock clock;

    public SchemaManager(NamedParameterJdbcTemplate jdbc, TextFormatter formatter, Clock clock) {
        this.jdbc = jdbc;
        this.formatter = formatter;
        this.clock = clock;
    }

    public static String tableNameFor(String projectUuid) {
        if (projectUuid == null) throw new IllegalArgumentException("projectUuid is required");
        String hex = projectUuid.replace("-", "").toLowerCase(Locale.ROOT);
        if (hex.length() < 12 || !hex.substring(0, 12).matches("[0-9a-f]{12}")) {
            throw new IllegalArgumentException("Not a UUID: " + projectUuid);
        }
        return "padron_" + hex.substring(0, 12);
    }

    /**
     * Sanitizes names, canonicalizes SQL types and checks the mandatory columns.
     * Returns the schema as it will be stored and created.
     */
    public List<PadronColumn> normalizeColumns(List<PadronColumn> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Padron schema must declare at least one column");
        }
        List<PadronColumn> out = new ArrayList<>(columns.size());
        Set<String> seen = new HashSet<>();
        for (PadronColumn c : columns) {
            if (c == null) throw new IllegalArgumentException("Padron schema contains an empty column entry");
            String name = IdentifierSanitizer.columnName(c.name());
            if (SYSTEM_COLUMNS.contains(name)) {
                throw new IllegalArgumentException("Column name is reserved: " + name);
            }
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Duplicate column: " + name);
            }
            String type = normalizeSqlType(c.sqlType());
            boolean account = PadronColumn.ACCOUNT.equals(name);
            if (account && !isTextType(type)) {
                throw new IllegalArgumentException("Column 'account' must be a text type, got " + type);
            }
            out.add(new PadronColumn(name, type, c.required() || account, c.unique() || account));
        }
        if (!seen.contains(PadronColumn.ACCOUNT)) {
            throw new IllegalArgumentException("Padron schema must declare an 'account' column");
        }
        if (!seen.contains(PadronColumn.DISPLAY_NAME)) {
            throw new IllegalArgumentException("Padron schema must declare a 'display_name' column");
        }
        return out;
    }

    public static String normalizeSqlType(String sqlType) {
        if (sqlType == null || sqlType.isBlank()) {
            throw new IllegalArgumentException("SQL type is required");
        }
        String t = sqlType.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
        String plain = PLAIN_TYPES.get(t);
        if (plain != null) return plain;
        Matcher m = SIZED_CHAR.matcher(t);
        if (m.matches()) {
            int n = Integer.parseInt(m.group(2));
            if (n < 1) throw new IllegalArgumentException("Invalid length in " + sqlType);
            return (m.group(1).contains("VAR") ? "VARCHAR(" : "CHAR(") + n + ")";
        }
        m = NUMERIC.matcher(t);
        if (m.matches()) {
            if (m.group(3) == null) return m.group(1);
            int precision = Integer.parseInt(m.group(3));
            int scale = m.group(5) == null ? 0 : Integer.parseInt(m.group(5));
            if (precision < 1 || scale > precision) throw new IllegalArgumentException("Invalid precision in " + sqlType);
            return m.group(1) + "(" + precision + (m.group(5) == null ? "" : "," + scale) + ")";
        }
        throw new IllegalArgumentException("SQL type not allowed: " + sqlType);
    }

    private static boolean isTextType(String sqlType) {
        return sqlType.startsWith("VARCHAR") || sqlType.startsWith("CHAR") || sqlType.equals("TEXT");
    }

    public String createTable(String projectUuid, List<PadronColumn> columns) {
        String table = tableNameFor(projectUuid);
        List<PadronColumn> schema = normalizeColumns(columns);
        if (tableExists(table)) {
            throw new IllegalStateException("Padron table already exists: " + table);
        }
        StringBuilder ddl = new StringBuilder("CREATE TABLE ").append(table).append(" (\n");
        ddl.append("  id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY");
        for (PadronColumn c : schema) {
            ddl.append(",\n  ").append(IdentifierSanitizer.requireSafe(c.name())).append(' ').append(c.sqlType());
            if (c.required()) ddl.append(" NOT NULL");
            if (c.unique()) ddl.append(" UNIQUE");
        }
        ddl.append(",\n  created_at TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP");
        ddl.append(",\n  updated_at TIMESTAMP WITH TIME ZONE");
        ddl.append(",\n  is_deleted BOOLEAN NOT NULL DEFAULT FALSE\n)");

        String index = IdentifierSanitizer.columnName("idx_" + table + "_account_name");
        jdbc.getJdbcTemplate().execute(ddl.toString());
        jdbc.getJdbcTemplate().execute("CREATE INDEX " + index + " ON " + table + " (account, display_name)");
        log.info("[Padron][Create] table={} columns={}", table, schema.size());
        return table;
    }

    public boolean dropTable(String tableName) {
        try {
            IdentifierSanitizer.requireSafe(tableName);
            jdbc.getJdbcTemplate().execute("DROP TABLE IF EXISTS " + tableName);
            log.info("[Padron][Drop] table={}", tableName);
            return true;
        } catch (IllegalArgumentException | DataAccessException e) {
            log.warn("[Padron][Drop] failed table={} reason={}", tableName, e.getMessage());
            return false;
        }
    }

    public boolean tableExists(String tableName) {
        String table = IdentifierSanitizer.requireSafe(tableName);
        Boolean found = jdbc.getJdbcTemplate().execute((ConnectionCallback<Boolean>) con -> {
            DatabaseMetaData md = con.getMetaData();
            try (ResultSet rs = md.getTables(con.getCatalog(), null, table, new String[]{"TABLE", "BASE TABLE"})) {
                while (rs.next()) {
                    if (table.equalsIgnoreCase(rs.getString("TABLE_NAME"))) return true;
                }
            }
            return false;
        });
        return Boolean.TRUE.equals(found);
    }

    /** Declared columns of a live table; system columns are left out. */
    public List<ColumnDescription> describe(String tableName) {
        String table = IdentifierSanitizer.requireSafe(tableName);
        List<ColumnDescription> cols = jdbc.getJdbcTemplate().execute((ConnectionCallback<List<ColumnDescription>>) con -> {
            List<ColumnDescription> out = new ArrayList<>();
            DatabaseMetaData md = con.getMetaData();
            try (ResultSet rs = md.getColumns(con.getCatalog(), null, table, null)) {
                while (rs.next()) {
                    if (!table.equalsIgnoreCase(rs.getString("TABLE_NAME"))) continue;
                    String name = rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT);
                    if (SYSTEM_COLUMNS.contains(name)) continue;
                    boolean nullable = rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls;
                    out.add(new ColumnDescription(name, rs.getString("TYPE_NAME").toLowerCase(Locale.ROOT), nullable));
                }
            }
            return out;
        });
        return cols == null ? List.of() : cols;
    }

    public List<Map<String, Object>> sampleRows(String tableName, int limit) {
        String table = IdentifierSanitizer.requireSafe(tableName);
        int clamped = Math.max(1, Math.min(MAX_SAMPLE, limit));
        String sql = "SELECT * FROM " + table + " WHERE is_deleted = FALSE ORDER BY id LIMIT :limit";
        return jdbc.queryForList(sql, new MapSqlParameterSource("limit", clamped));
    }

    /**
     * Live padron rows for the given accounts keyed by account. Read-only; soft-deleted rows are invisible.
     */
    public Map<String, Map<String, Object>> findByAccounts(String tableName, Collection<String> accounts) {
        String table = IdentifierSanitizer.requireSafe(tableName);
        Map<String, Map<String, Object>> out = new LinkedHashMap<>();
        if (accounts == null || accounts.isEmpty()) return out;
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(accounts));
        String sql = "SELECT * FROM " + table + " WHERE is_deleted = FALSE AND account IN (:accounts)";
        for (int from = 0; from < distinct.size(); from += IN_CHUNK) {
            List<String> chunk = distinct.subList(from, Math.min(distinct.size(), from + IN_CHUNK));
            for (Map<String, Object> row : jdbc.queryForList(sql, new MapSqlParameterSource("accounts", chunk))) {
                Object account = row.get(PadronColumn.ACCOUNT);
                if (account != null) out.put(account.toString(), row);
            }
        }
        return out;
    }

    /**
     * Maps a padron CSV header to declared column names. The header may name a subset of the
     * declared columns but must carry the account and display name.
     */
    public List<String> validateHeader(List<String> header, List<PadronColumn> schema) {
        if (header == null || header.isEmpty()) {
            throw new IllegalArgumentException("Padron CSV has no header");
        }
        Set<String> declared = new HashSet<>();
        for (PadronColumn c : schema) declared.add(c.name());
        List<String> mapped = new ArrayList<>(header.size());
        List<String> unknown = new ArrayList<>();
        for (String raw : header) {
            String h = raw == null ? "" : raw.replace("\uFEFF", "").trim();
            if (h.isEmpty()) {
                throw new IllegalArgumentException("Padron CSV header contains an empty column name");
            }
            String name = IdentifierSanitizer.columnName(h);
            name = HEADER_ALIASES.getOrDefault(name, name);
            if (!declared.contains(name)) unknown.add(h);
            if (mapped.contains(name)) throw new IllegalArgumentException("Duplicate header column: " + h);
            mapped.add(name);
        }
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Header columns not in the padron schema: " + unknown);
        }
        if (!mapped.contains(PadronColumn.ACCOUNT) || !mapped.contains(PadronColumn.DISPLAY_NAME)) {
            throw new IllegalArgumentException("Padron CSV must contain 'account' and 'display_name' columns");
        }
        return mapped;
    }

    public PadronLoadResult loadCsv(String tableName, List<PadronColumn> schema, InputStream csv, boolean merge) throws IOException {
        ParsedCsv parsed = parseCsv(csv);
        List<String> columns = validateHeader(parsed.header(), schema);
        return loadRows(tableName, schema, parsed.rowsKeyedBy(columns), merge);
    }

    /** Declared layout and raw rows read from a padron CSV that has no schema yet. */
    public record InferredPadron(List<PadronColumn> columns, List<Map<String, String>> rows) {}

    /**
     * Derives a padron schema from a CSV header and its values. {@code cuenta}/{@code account} becomes
     * the required unique text key and {@code nombre}/{@code display_name} is required. With type
     * detection off, or for a column without values, every column is {@code VARCHAR(255)}.
     */
    public InferredPadron inferFromCsv(InputStream csv, boolean detectTypes) throws IOException {
        ParsedCsv parsed = parseCsv(csv);
        if (parsed.header().isEmpty()) {
            throw new IllegalArgumentException("Padron CSV has no header");
        }
        List<String> names = new ArrayList<>();
        for (String raw : parsed.header()) {
            String h = raw == null ? "" : raw.replace("\uFEFF", "").trim();
            if (h.isEmpty()) {
                throw new IllegalArgumentException("Padron CSV header contains an empty column name");
            }
            String name = IdentifierSanitizer.columnName(h);
            name = HEADER_ALIASES.getOrDefault(name, name);
            if (names.contains(name)) throw new IllegalArgumentException("Duplicate header column: " + h);
            names.add(name);
        }
        if (!names.contains(PadronColumn.ACCOUNT)) {
            throw new IllegalArgumentException("Padron CSV must contain the 'cuenta' column");
        }
        if (!names.contains(PadronColumn.DISPLAY_NAME)) {
            throw new IllegalArgumentException("Padron CSV must contain the 'nombre' column");
        }
        List<Map<String, String>> rows = parsed.rowsKeyedBy(names);
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("Padron CSV has no data rows");
        }

        List<PadronColumn> columns = new ArrayList<>(names.size());
        for (String name : names) {
            boolean account = PadronColumn.ACCOUNT.equals(name);
            List<String> values = new ArrayList<>(rows.size());
            for (Map<String, String> row : rows) values.add(row.get(name));
            String type = detectTypes ? inferSqlType(values, account) : "VARCHAR(" + MAX_INFERRED_VARCHAR + ")";
            columns.add(new PadronColumn(name, type, account || PadronColumn.DISPLAY_NAME.equals(name), account));
        }
        log.info("[Padron][Infer] columns={} rows={} detectTypes={}", columns.size(), rows.size(), detectTypes);
        return new InferredPadron(columns, rows);
    }

    /**
     * Narrowest allow-listed type that every non-blank value converts to: integer, decimal, date,
     * then text sized at twice the longest value. Zero-padded digit strings stay text.
     */
    String inferSqlType(List<String> values, boolean textOnly) {
        boolean any = false, allInt = true, fitsInt = true, allNumber = true, allDate = true;
        int maxLen = 0;
        int maxIntegerDigits = 0;
        for (String raw : values) {
            if (raw == null || raw.isBlank()) continue;
            String v = raw.trim();
            any = true;
            maxLen = Math.max(maxLen, v.length());
            if (textOnly) continue;
            boolean zeroPadded = v.length() > 1 && v.charAt(0) == '0' && Character.isDigit(v.charAt(1));
            if (allInt && (zeroPadded || !PLAIN_INTEGER.matcher(v).matches())) allInt = false;
            if (allInt && new BigInteger(v).bitLength() >= 32) fitsInt = false;
            if (allNumber) {
                BigDecimal n = zeroPadded ? null : formatter.parseNumber(v);
                if (n == null) {
                    allNumber = false;
                } else {
                    maxIntegerDigits = Math.max(maxIntegerDigits, n.precision() - n.scale());
                }
            }
            if (allDate && formatter.parseDate(v) == null) allDate = false;
        }
        if (!any) return "VARCHAR(" + MAX_INFERRED_VARCHAR + ")";
        if (!textOnly) {
            if (allInt) return fitsInt ? "INTEGER" : "BIGINT";
            if (allNumber) return maxIntegerDigits <= 8 ? "DECIMAL(10,2)" : "NUMERIC";
            if (allDate) return "DATE";
        }
        if (maxLen > MAX_INFERRED_VARCHAR) return "TEXT";
        return "VARCHAR(" + Math.min(maxLen * 2, MAX_INFERRED_VARCHAR) + ")";
    }

    private record ParsedCsv(List<String> header, List<CSVRecord> records) {
        List<Map<String, String>> rowsKeyedBy(List<String> columns) {
            List<Map<String, String>> rows = new ArrayList<>(records.size());
            for (CSVRecord rec : records) {
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    row.put(columns.get(i), i < rec.size() ? rec.get(i) : null);
                }
                rows.add(row);
            }
            return rows;
        }
    }

    private static ParsedCsv parseCsv(InputStream csv) throws IOException {
        CSVFormat fmt = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .build();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(csv, StandardCharsets.UTF_8));
             CSVParser parser = new CSVParser(reader, fmt)) {
            List<String> header = parser.getHeaderNames();
            return new ParsedCsv(header == null ? List.of() : header, parser.getRecords());
        } catch (UncheckedIOException | IllegalStateException e) {
            throw new IllegalArgumentException("Padron CSV could not be parsed: " + e.getMessage(), e);
        }
    }

    /**
     * Inserts or merges rows keyed by account. Values arrive as text and are converted to the
     * declared column type before binding.
     *
     * @throws PadronLoadException on the first failing row, carrying the counts applied so far
     */
    public PadronLoadResult loadRows(String tableName, List<PadronColumn> schema, List<Map<String, String>> rows, boolean merge) {
        String table = IdentifierSanitizer.requireSafe(tableName);
        Map<String, PadronColumn> byName = new LinkedHashMap<>();
        for (PadronColumn c : schema) byName.put(IdentifierSanitizer.requireSafe(c.name()), c);

        int inserted = 0, updated = 0, skipped = 0;
        int rowNumber = 0;
        for (Map<String, String> row : rows) {
            rowNumber++;
            try {
                MapSqlParameterSource params = new MapSqlParameterSource();
                List<String> provided = new ArrayList<>();
                for (Map.Entry<String, String> e : row.entrySet()) {
                    PadronColumn col = byName.get(e.getKey());
                    if (col == null) {
                        throw new IllegalArgumentException("Unknown column: " + e.getKey());
                    }
                    Object value = convert(col, e.getValue());
                    params.addValue(col.name(), value, jdbcType(col.sqlType()));
                    provided.add(col.name());
                }
                for (PadronColumn col : byName.values()) {
                    if (col.required() && (!params.hasValue(col.name()) || params.getValue(col.name()) == null)) {
                        throw new IllegalArgumentException("Required column is empty: " + col.name());
                    }
                }
                String account = String.valueOf(params.getValue(PadronColumn.ACCOUNT));
                OffsetDateTime now = OffsetDateTime.now(clock);
                params.addValue("sys_now", now);

                boolean exists = accountExists(table, account);
                if (exists && !merge) {
                    skipped++;
                    continue;
                }
                if (exists) {
                    StringBuilder sql = new StringBuilder("UPDATE ").append(table).append(" SET ");
                    for (String c : provided) {
                        if (PadronColumn.ACCOUNT.equals(c)) continue;
                        sql.append(c).append(" = :").append(c).append(", ");
                    }
                    sql.append("updated_at = :sys_now, is_deleted = FALSE WHERE account = :account");
                    jdbc.update(sql.toString(), params);
                    updated++;
                } else {
                    String cols = String.join(", ", provided);
                    StringBuilder values = new StringBuilder();
                    for (String c : provided) values.append(':').append(c).append(", ");
                    String sql = "INSERT INTO " + table + " (" + cols + ", created_at, updated_at, is_deleted) VALUES ("
                            + values + ":sys_now, :sys_now, FALSE)";
                    try {
                        jdbc.update(sql, params);
                        inserted++;
                    } catch (DuplicateKeyException dup) {
                        if (merge) throw dup;
                        skipped++;
                    }
                }
            } catch (RuntimeException e) {
                log.warn("[Padron][Load] table={} aborted at row={} inserted={} updated={} skipped={} reason={}",
                        table, rowNumber, inserted, updated, skipped, e.getMessage());
                throw new PadronLoadException("Padron load failed at row " + rowNumber + ": " + e.getMessage(),
                        inserted, updated, skipped, rowNumber, e);
            }
        }
        log.info("[Padron][Load] table={} merge={} inserted={} updated={} skipped={}", table, merge, inserted, updated, skipped);
        return new PadronLoadResult(inserted, updated, skipped);
    }

    private boolean accountExists(String table, String account) {
        Integer n = jdbc.queryForObject("SELECT COUNT(*) FROM " + table + " WHERE account = :account",
                new MapSqlParameterSource("account", account), Integer.class);
        return n != null && n > 0;
    }

    Object convert(PadronColumn col, String raw) {
        if (raw == null) return null;
        String v = raw.trim();
        if (v.isEmpty()) return null;
        String type = col.sqlType();
        if (isTextType(type)) {
            return v;
        }
        switch (type) {
            case "INTEGER":
            case "SMALLINT":
                return requireNumber(col, v).intValueExact();
            case "BIGINT":
                return requireNumber(col, v).longValueExact();
            case "REAL":
            case "DOUBLE PRECISION":
                return requireNumber(col, v).doubleValue();
            case "BOOLEAN":
                return parseBoolean(col, v);
            case "DATE":
                LocalDate d = formatter.parseDate(v);
                if (d == null) throw new IllegalArgumentException("Invalid date for " + col.name() + ": " + v);
                return d;
            case "TIMESTAMP":
                return parseTimestamp(col, v);
            default:
                if (type.startsWith("NUMERIC") || type.startsWith("DECIMAL")) return requireNumber(col, v);
                return v;
        }
    }

    private BigDecimal requireNumber(PadronColumn col, String v) {
        BigDecimal n = formatter.parseNumber(v);
        if (n == null) throw new IllegalArgumentException("Invalid number for " + col.name() + ": " + v);
        return n;
    }

    private static Boolean parseBoolean(PadronColumn col, String v) {
        String s = v.toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(s)) return Boolean.TRUE;
        if (FALSE_WORDS.contains(s)) return Boolean.FALSE;
        throw new IllegalArgumentException("Invalid boolean for " + col.name() + ": " + v);
    }

    private LocalDateTime parseTimestamp(PadronColumn col, String v) {
        for (DateTimeFormatter f : List.of(DateTimeFormatter.ISO_LOCAL_DATE_TIME,
                DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
                DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
                DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss"),
                DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm"))) {
            try {
                return LocalDateTime.parse(v, f);
            } catch (DateTimeParseException ignored) {
                // try the next pattern
            }
        }
        LocalDate d = formatter.parseDate(v);
        if (d == null) throw new IllegalArgumentException("Invalid timestamp for " + col.name() + ": " + v);
        return d.atStartOfDay();
    }

    private static int jdbcType(String sqlType) {
        if (isTextType(sqlType)) return Types.VARCHAR;
        if (sqlType.startsWith("NUMERIC") || sqlType.startsWith("DECIMAL")) return Types.NUMERIC;
        return switch (sqlType) {
            case "INTEGER" -> Types.INTEGER;
            case "SMALLINT" -> Types.SMALLINT;
            case "BIGINT" -> Types.BIGINT;
            case "REAL" -> Types.REAL;
            case "DOUBLE PRECISION" -> Types.DOUBLE;
            case "BOOLEAN" -> Types.BOOLEAN;
            case "DATE" -> Types.DATE;
            case "TIMESTAMP" -> Types.TIMESTAMP;
            default -> Types.VARCHAR;
        };
    }
}
