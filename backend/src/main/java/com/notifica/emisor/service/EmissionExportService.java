package com.notifica.emisor.service;

import com.notifica.emisor.dto.ArtifactDTO;
import com.notifica.emisor.model.EmissionArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/** Read side of a session: artifact listing and a ZIP of the PDFs it produced. */
@Service
public class EmissionExportService {
    private static final Logger log = LoggerFactory.getLogger(EmissionExportService.class);

    private final AuditRecorder auditRecorder;

    public EmissionExportService(AuditRecorder auditRecorder) {
        this.auditRecorder = auditRecorder;
    }

    public List<ArtifactDTO> artifacts(String sessionId) {
        return auditRecorder.findBySession(sessionId).stream()
                .map(a -> new ArtifactDTO(a.getAccount(), a.getPrintOrder(), a.getVisitaCode(), a.getBarcodePayload(),
                        a.getFilePath(), a.getFileSize(), a.getSha256Hash(), a.getRenderedBy(), a.getRenderedAt(), a.getError()))
                .toList();
    }

    /**
     * Writes every successfully rendered PDF of the session that is still on disk into a ZIP.
     * Entries are named {@code <print_order>_<file name>} so the archive sorts in print order.
     *
     * @return number of entries written
     */
    public int writeZip(String sessionId, OutputStream out) throws IOException {
        List<EmissionArtifact> artifacts = auditRecorder.findBySession(sessionId);
        if (artifacts.isEmpty()) {
            throw new IllegalArgumentException("No artifacts for session " + sessionId);
        }
        int written = 0, missing = 0;
        Set<String> names = new HashSet<>();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            for (EmissionArtifact a : artifacts) {
                if (!a.isSuccessful() || a.getFilePath() == null) continue;
                Path file = Path.of(a.getFilePath());
                if (!Files.isRegularFile(file)) {
                    missing++;
                    continue;
                }
                String name = String.format("%06d_%s", a.getPrintOrder(), file.getFileName());
                if (!names.add(name)) continue;
                zip.putNextEntry(new ZipEntry(name));
                Files.copy(file, zip);
                zip.closeEntry();
                written++;
            }
        }
        log.info("[Export][Zip] sessionId={} entries={} missingFiles={}", sessionId, written, missing);
        return written;
    }
}
