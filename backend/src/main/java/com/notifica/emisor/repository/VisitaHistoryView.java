package com.notifica.emisor.repository;

import java.time.Instant;
import java.time.LocalDate;

public interface VisitaHistoryView {
    String getAccount();
    String getDocumentType();
    String getVisitaCode();
    LocalDate getEmissionDate();
    Instant getCreatedAt();
    Long getId();
}
