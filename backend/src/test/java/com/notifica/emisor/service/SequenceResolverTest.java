package com.notifica.emisor.service;

import com.notifica.emisor.model.EmissionArtifact;
import com.notifica.emisor.repository.EmissionArtifactRepository;
import com.notifica.emisor.repository.VisitaHistoryView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SequenceResolverTest {

    @Mock private EmissionArtifactRepository artifactRepository;

    private SequenceResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new SequenceResolver(artifactRepository);
    }

    private static EmissionArtifact withPmo(String label) {
        EmissionArtifact a = new EmissionArtifact();
        a.setPmoLabel(label);
        return a;
    }

    @Test
    void pmoContinuesFromLatestSuccessfulArtifact() {
        when(artifactRepository.findFirstByProjectIdAndErrorIsNullOrderByCreatedAtDescIdDesc(1L))
                .thenReturn(Optional.of(withPmo("PMO 4")));
        assertThat(resolver.resolvePmoSequence(1L)).isEqualTo(5);
    }

    @Test
    void pmoStartsAtOneWithoutHistoryOrWithCustomLabel() {
        when(artifactRepository.findFirstByProjectIdAndErrorIsNullOrderByCreatedAtDescIdDesc(1L))
                .thenReturn(Optional.empty());
        when(artifactRepository.findFirstByProjectIdAndErrorIsNullOrderByCreatedAtDescIdDesc(2L))
                .thenReturn(Optional.of(withPmo("Campaña Marzo")));

        assertThat(resolver.resolvePmoSequence(1L)).isEqualTo(1);
        assertThat(resolver.resolvePmoSequence(2L)).isEqualTo(1);
    }

    @Test
    void historyFailureSurfacesAsSequenceLookupException() {
        when(artifactRepository.findFirstByProjectIdAndErrorIsNullOrderByCreatedAtDescIdDesc(1L))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));
        assertThatThrownBy(() -> resolver.resolvePmoSequence(1L))
                .isInstanceOf(SequenceLookupException.class)
                .hasMessageContaining("project 1");
    }

    @Test
    void visitaContinuesFromLatestArtifactOfSameDocumentType() {
        when(artifactRepository.findLatestVisitaPerAccount(eq(7L), anyCollection())).thenReturn(List.of(
                view(1L, "A1", "NOT", "NOT2", LocalDate.of(2024, 1, 5)),
                view(2L, "A1", "NOT", "NOT3", LocalDate.of(2024, 2, 5)),
                view(3L, "A2", "REQ", "REQ6", LocalDate.of(2024, 2, 5)),
                view(4L, "A3", "REQ", "REQ2", LocalDate.of(2024, 1, 5)),
                view(5L, "A3", "NOT", "NOT1", LocalDate.of(2024, 3, 5))
        ));

        SequenceResolver.VisitaTracker tracker = resolver.visitaTracker(7L, "NOT", List.of("A1", "A2", "A3", "A4"));

        assertThat(tracker.peek("A1")).isEqualTo("NOT4");
        assertThat(tracker.next("A1")).isEqualTo("NOT4");
        assertThat(tracker.next("A1")).isEqualTo("NOT5");
        // latest artifact of A2 is another document type
        assertThat(tracker.next("A2")).isEqualTo("NOT1");
        assertThat(tracker.next("A3")).isEqualTo("NOT2");
        assertThat(tracker.next("A4")).isEqualTo("NOT1");
    }

    @Test
    void historyIsQueriedInChunks() {
        List<String> accounts = new ArrayList<>();
        for (int i = 0; i < 1200; i++) accounts.add("C" + i);
        when(artifactRepository.findLatestVisitaPerAccount(eq(1L), anyCollection())).thenReturn(List.of());

        resolver.visitaTracker(1L, "NOT", accounts);

        verify(artifactRepository, times(3)).findLatestVisitaPerAccount(eq(1L), anyCollection());
    }

    @Test
    void visitaNumberAndPayloadFormat() {
        assertThat(SequenceResolver.visitaNumber("NOT", "NOT12")).isEqualTo(12);
        assertThat(SequenceResolver.visitaNumber("NOT", "sin numero")).isZero();
        assertThat(SequenceResolver.visitaNumber("NOT", null)).isZero();
        assertThat(SequenceResolver.barcodePayload("A1", LocalDate.of(2024, 1, 5), "NOT1")).isEqualTo("*A1*20240105*NOT1*");
        assertThat(SequenceResolver.pmoLabel(3)).isEqualTo("PMO 3");
        assertThat(SequenceResolver.parsePmoNumber(" pmo 12 ")).contains(12);
        assertThat(SequenceResolver.parsePmoNumber("PMO-12")).isEmpty();
    }

    private static VisitaHistoryView view(Long id, String account, String documentType, String code, LocalDate date) {
        return new VisitaHistoryView() {
            @Override public String getAccount() { return account; }
            @Override public String getDocumentType() { return documentType; }
            @Override public String getVisitaCode() { return code; }
            @Override public LocalDate getEmissionDate() { return date; }
            @Override public Instant getCreatedAt() { return Instant.parse("2024-01-01T00:00:00Z").plusSeconds(id); }
            @Override public Long getId() { return id; }
        };
    }
}
