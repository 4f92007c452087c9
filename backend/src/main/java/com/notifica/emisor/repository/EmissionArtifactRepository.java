package com.notifica.emisor.repository;

import com.notifica.emisor.model.EmissionArtifact;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Append-only access to the emission audit trail: rows can be inserted and read,
 * the interface exposes no update or delete.
 */
public interface EmissionArtifactRepository extends Repository<EmissionArtifact, Long> {

    EmissionArtifact save(EmissionArtifact artifact);

    List<EmissionArtifact> findBySessionIdOrderByPrintOrderAsc(String sessionId);

    /** Latest successful artifact of a project, source of the next PMO number. */
    Optional<EmissionArtifact> findFirstByProjectIdAndErrorIsNullOrderByCreatedAtDescIdDesc(Long projectId);

    /**
     * Latest successful artifact per account: no newer successful row of the same project and
     * account exists, newer meaning a later emission date, then a later creation time, then a larger id.
     */
    @Query("select a.account as account, a.documentType as documentType, a.visitaCode as visitaCode, "
            + "a.emissionDate as emissionDate, a.createdAt as createdAt, a.id as id "
            + "from EmissionArtifact a "
            + "where a.projectId = :projectId and a.error is null and a.account in :accounts "
            + "and not exists (select b.id from EmissionArtifact b "
            + "where b.projectId = a.projectId and b.account = a.account and b.error is null "
            + "and (b.emissionDate > a.emissionDate "
            + "or (b.emissionDate = a.emissionDate and b.createdAt > a.createdAt) "
            + "or (b.emissionDate = a.emissionDate and b.createdAt = a.createdAt and b.id > a.id)))")
    List<VisitaHistoryView> findLatestVisitaPerAccount(@Param("projectId") Long projectId,
                                                       @Param("accounts") Collection<String> accounts);
}
