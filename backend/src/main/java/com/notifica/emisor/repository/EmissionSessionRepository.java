package com.notifica.emisor.repository;

import com.notifica.emisor.model.EmissionSession;
import org.springframework.data.repository.Repository;

import java.util.Optional;

/** Insert and read only. */
public interface EmissionSessionRepository extends Repository<EmissionSession, Long> {
    EmissionSession save(EmissionSession session);
    Optional<EmissionSession> findBySessionId(String sessionId);
}
