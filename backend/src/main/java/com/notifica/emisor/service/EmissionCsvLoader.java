package com.notifica.emisor.service;

import com.notifica.emisor.model.InputRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Parses and structurally validates an emission CSV. Problems are collected across the whole
 * file and reported together.
 */
@Component
public class EmissionCsvLoader {
    private static final Logger log = LoggerFactory.getLogger(EmissionCsvLoader.class);

    public static final String ACCOUNT = "account";
    public static final String PRINT_ORDER = "print_order";
    private static final Map<String, String> ALIASES = Map.of(
            "cuenta", ACCOUNT,
            "orden_impresion", PRINT_ORDER
    );
    private static final int MAX_REPORTED_PROBLEMS = 50;

    public record LoadedCsv(List<InputRecord> records, List<String> extraColumns) {
        public Set<String> uniqueAccounts() {
            Set<String> out = new LinkedHashSet<>();
            for (InputRecord r : records) out.add(r.account());
            return out;
        }
    }

    public LoadedCsv load(byte[] content) {
        if (content == null || content.length == 0) {
            throw new EmissionValidationException("CSV file is empty");
        }
        CSVFormat fmt = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .setAllowMissingColumnNames(true)
                .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_EMPTY)
                .build();
        try (Reader reader = new InputStreamReader(stripBom(content), StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, fmt)) {
            List<String> rawHeader = parser.getHeaderNames();
            Map<String, String> columns = canonicalHeader(rawHeader);
            List<String> missing = new ArrayList<>();
            if (!columns.containsKey(ACCOUNT)) missing.add("account/cuenta");
            if (!columns.containsKey(PRINT_ORDER)) missing.add("print_order/orden_impresion");
            if (!missing.isEmpty()) {
                throw new EmissionValidationException("CSV is missing required columns: " + String.join(", ", missing));
            }
            List<String> extras = new ArrayList<>();
            for (Map.Entry<String, String> e : columns.entrySet()) {
                if (!ACCOUNT.equals(e.getKey()) && !PRINT_ORDER.equals(e.getKey())) extras.add(e.getKey());
            }

            List<InputRecord> records = new ArrayList<>();
            List<String> problems = new ArrayList<>();
            Map<Integer, Long> seenOrders = new HashMap<>();
            for (CSVRecord rec : parser) {
                long line = rec.getRecordNumber() + 1; // header is line 1
                String account = value(rec, columns.get(ACCOUNT));
                String orderRaw = value(rec, columns.get(PRINT_ORDER));
                boolean ok = true;
                if (account == null || account.isEmpty()) {
                    problems.add("line " + line + ": account is empty");
                    ok = false;
                }
                Integer order = parseOrder(orderRaw);
                if (order == null) {
                    problems.add("line " + line + ": print_order is not an integer: '" + (orderRaw == null ? "" : orderRaw) + "'");
                    ok = false;
                } else {
                    Long previous = seenOrders.putIfAbsent(order, line);
                    if (previous != null) {
                        problems.add("line " + line + ": print_order " + order + " already used on line " + previous);
                        ok = false;
                    }
                }
                if (!ok) continue;
                Map<String, String> extra = new LinkedHashMap<>();
                for (String col : extras) extra.put(col, value(rec, columns.get(col)));
                records.add(new InputRecord(account, order, extra, line));
            }
            if (!problems.isEmpty()) {
                log.warn("[Emission][CsvInvalid] problems={}", problems.size());
                List<String> reported = problems.size() > MAX_REPORTED_PROBLEMS ? problems.subList(0, MAX_REPORTED_PROBLEMS) : problems;
                throw new EmissionValidationException("CSV has " + problems.size() + " invalid record(s)", new ArrayList<>(reported));
            }
            if (records.isEmpty()) {
                throw new EmissionValidationException("CSV has no data records");
            }
            log.debug("[Emission][CsvLoaded] records={} extraColumns={}", records.size(), extras);
            return new LoadedCsv(records, extras);
        } catch (EmissionValidationException e) {
            throw e;
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            // malformed quoting surfaces from record iteration, duplicate headers from the parser constructor
            log.warn("[Emission][CsvUnparseable] {}", e.getMessage());
            throw new EmissionValidationException("CSV could not be parsed: " + e.getMessage());
        }
    }

    private static ByteArrayInputStream stripBom(byte[] content) {
        boolean bom = content.length >= 3 && (content[0] & 0xFF) == 0xEF && (content[1] & 0xFF) == 0xBB && (content[2] & 0xFF) == 0xBF;
        return bom ? new ByteArrayInputStream(content, 3, content.length - 3) : new ByteArrayInputStream(content);
    }

    /** Canonical column name to the header name as written in the file. */
    private static Map<String, String> canonicalHeader(List<String> header) {
        if (header == null || header.isEmpty()) {
            throw new EmissionValidationException("CSV has no header row");
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (String raw : header) {
            String h = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
            if (h.isEmpty()) continue;
            h = ALIASES.getOrDefault(h, h);
            if (out.putIfAbsent(h, raw) != null) {
                throw new EmissionValidationException("CSV header repeats column '" + h + "'");
            }
        }
        return out;
    }

    private static String value(CSVRecord rec, String headerName) {
        if (headerName == null || !rec.isSet(headerName)) return null;
        return rec.get(headerName);
    }

    private static Integer parseOrder(String raw) {
        if (raw == null || raw.isEmpty()) return null;
        try {
            return Integer.valueOf(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
