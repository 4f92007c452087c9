package com.notifica.emisor.service;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;

/** Writes {@code unmatched_<session>.csv}, one account per row under a {@code Cuenta} header. */
@Component
public class UnmatchedReportWriter {

    public Path write(Path directory, String sessionId, Collection<String> accounts) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve("unmatched_" + sessionId + ".csv");
        CSVFormat fmt = CSVFormat.DEFAULT.builder().setHeader("Cuenta").build();
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, fmt)) {
            for (String account : accounts) {
                printer.printRecord(account);
            }
        }
        return target;
    }
}
