package com.notifica.emisor.service;

import com.notifica.emisor.model.EmissionArtifact;
import com.notifica.emisor.repository.EmissionArtifactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Appends emission artifacts. Each attempted record is written exactly once and never touched again.
 */
@Service
public class AuditRecorder {
    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);

    private final EmissionArtifactRepository repository;
    private final Clock clock;

    public AuditRecorder(EmissionArtifactRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public EmissionArtifact record(EmissionArtifact artifact) {
        if (artifact.getId() != null) {
            throw new IllegalArgumentException("Artifact already recorded: id=" + artifact.getId());
        }
        if (artifact.getCreatedAt() == null) {
            artifact.setCreatedAt(clock.instant());
        }
        EmissionArtifact saved = repository.save(artifact);
        if (log.isDebugEnabled()) {
            log.debug("[Audit][Record] sessionId={} account={} printOrder={} ok={}",
                    saved.getSessionId(), saved.getAccount(), saved.getPrintOrder(), saved.isSuccessful());
        }
        return saved;
    }

    public List<EmissionArtifact> findBySession(String sessionId) {
        return repository.findBySessionIdOrderByPrintOrderAsc(sessionId);
    }
}
