package com.notifica.emisor.repository;

import com.notifica.emisor.model.EmissionArtifact;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class EmissionArtifactRepositoryTest {

    private static final long PROJECT = 990_001L;
    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    @Autowired private EmissionArtifactRepository artifactRepository;

    @Test
    void visitaLookupReturnsOnlyTheLatestSuccessfulRowPerAccount() {
        LocalDate d1 = LocalDate.of(2025, 3, 1);
        LocalDate d2 = LocalDate.of(2025, 4, 1);
        // A1: older date, newer date, then a failed row on an even later date
        save(PROJECT, "A1", "NOT1", d1, T0, null);
        save(PROJECT, "A1", "NOT2", d2, T0, null);
        save(PROJECT, "A1", "NOT3", d2.plusDays(5), T0, "render failed");
        // A2: same date, later creation time wins
        save(PROJECT, "A2", "REQ1", d1, T0.plusSeconds(60), null);
        save(PROJECT, "A2", "NOT1", d1, T0, null);
        // A3: same date and creation time, larger id wins
        save(PROJECT, "A3", "NOT1", d1, T0, null);
        save(PROJECT, "A3", "NOT2", d1, T0, null);
        // other project and an account not asked for
        save(PROJECT + 1, "A1", "NOT9", d2.plusDays(30), T0, null);
        save(PROJECT, "B9", "NOT4", d2, T0, null);

        List<VisitaHistoryView> rows = artifactRepository.findLatestVisitaPerAccount(PROJECT, List.of("A1", "A2", "A3", "ZZ"));

        assertThat(rows).hasSize(3);
        Map<String, VisitaHistoryView> byAccount = rows.stream()
                .collect(Collectors.toMap(VisitaHistoryView::getAccount, Function.identity()));
        assertThat(byAccount.get("A1").getVisitaCode()).isEqualTo("NOT2");
        assertThat(byAccount.get("A2").getVisitaCode()).isEqualTo("REQ1");
        assertThat(byAccount.get("A3").getVisitaCode()).isEqualTo("NOT2");
    }

    @Test
    void accountWithOnlyFailedRowsHasNoHistory() {
        save(PROJECT, "F1", "NOT1", LocalDate.of(2025, 3, 1), T0, "padron value missing");

        assertThat(artifactRepository.findLatestVisitaPerAccount(PROJECT, List.of("F1"))).isEmpty();
    }

    private void save(long projectId, String account, String visitaCode, LocalDate date, Instant createdAt, String error) {
        EmissionArtifact a = new EmissionArtifact();
        a.setSessionId(UUID.randomUUID().toString());
        a.setProjectId(projectId);
        a.setTemplateId(1L);
        a.setAccount(account);
        a.setPrintOrder(1);
        a.setDataJson("{}");
        a.setDocumentType(visitaCode.replaceAll("\\d", ""));
        a.setPmoLabel("PMO 1");
        a.setEmissionDate(date);
        a.setVisitaCode(visitaCode);
        a.setError(error);
        a.setCreatedAt(createdAt);
        artifactRepository.save(a);
    }
}
