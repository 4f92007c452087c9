package com.notifica.emisor.service;

import com.notifica.emisor.model.EmissionArtifact;
import com.notifica.emisor.repository.EmissionArtifactRepository;
import com.notifica.emisor.repository.VisitaHistoryView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Continues the PMO and visita numbering from the artifact history. Only successful artifacts count.
 * Called on the coordinating thread before any batch is dispatched.
 */
@Service
public class SequenceResolver {
    private static final Logger log = LoggerFactory.getLogger(SequenceResolver.class);

    private static final Pattern PMO_LABEL = Pattern.compile("^\\s*PMO\\s+(\\d+)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_INT = Pattern.compile("(\\d+)$");
    private static final DateTimeFormatter PAYLOAD_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final int IN_CHUNK = 500;

    private final EmissionArtifactRepository artifactRepository;

    public SequenceResolver(EmissionArtifactRepository artifactRepository) {
        this.artifactRepository = artifactRepository;
    }

    /**
     * Next PMO number for the project: one more than the latest successful artifact's
     * {@code "PMO n"} label, or 1 when there is none or its label has another shape.
     */
    public int resolvePmoSequence(Long projectId) {
        Optional<EmissionArtifact> latest;
        try {
            latest = artifactRepository.findFirstByProjectIdAndErrorIsNullOrderByCreatedAtDescIdDesc(projectId);
        } catch (DataAccessException e) {
            throw new SequenceLookupException("PMO history unavailable for project " + projectId, e);
        }
        int next = latest.map(EmissionArtifact::getPmoLabel)
                .flatMap(SequenceResolver::parsePmoNumber)
                .map(n -> n + 1)
                .orElse(1);
        log.debug("[Emission][Pmo] projectId={} next={}", projectId, next);
        return next;
    }

    public static String pmoLabel(int sequence) {
        return "PMO " + sequence;
    }

    static Optional<Integer> parsePmoNumber(String label) {
        if (label == null) return Optional.empty();
        Matcher m = PMO_LABEL.matcher(label);
        if (!m.matches()) return Optional.empty();
        try {
            return Optional.of(Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Seeds a per-run visita counter for the given accounts from their latest successful artifact.
     */
    public VisitaTracker visitaTracker(Long projectId, String documentType, Collection<String> accounts) {
        Map<String, Integer> last = new HashMap<>();
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(accounts));
        Map<String, VisitaHistoryView> latestByAccount = new HashMap<>();
        try {
            for (int from = 0; from < distinct.size(); from += IN_CHUNK) {
                List<String> chunk = distinct.subList(from, Math.min(distinct.size(), from + IN_CHUNK));
                for (VisitaHistoryView v : artifactRepository.findLatestVisitaPerAccount(projectId, chunk)) {
                    latestByAccount.merge(v.getAccount(), v, (a, b) -> isNewer(b, a) ? b : a);
                }
            }
        } catch (DataAccessException e) {
            throw new SequenceLookupException("Visita history unavailable for project " + projectId, e);
        }
        for (Map.Entry<String, VisitaHistoryView> e : latestByAccount.entrySet()) {
            VisitaHistoryView v = e.getValue();
            if (documentType.equals(v.getDocumentType())) {
                last.put(e.getKey(), visitaNumber(documentType, v.getVisitaCode()));
            }
        }
        log.debug("[Emission][Visita] projectId={} accounts={} withHistory={}", projectId, distinct.size(), last.size());
        return new VisitaTracker(documentType, last);
    }

    /** Emission date first, then creation time, then id. */
    static boolean isNewer(VisitaHistoryView candidate, VisitaHistoryView current) {
        int c = compareNullable(candidate.getEmissionDate(), current.getEmissionDate());
        if (c == 0) c = compareNullable(candidate.getCreatedAt(), current.getCreatedAt());
        if (c == 0) c = compareNullable(candidate.getId(), current.getId());
        return c > 0;
    }

    private static <T extends Comparable<? super T>> int compareNullable(T a, T b) {
        if (a == null) return b == null ? 0 : -1;
        if (b == null) return 1;
        return a.compareTo(b);
    }

    /** Numeric part of a visita code; 0 when it has none. */
    static int visitaNumber(String documentType, String code) {
        if (code == null) return 0;
        String tail = code.startsWith(documentType) ? code.substring(documentType.length()) : code;
        Matcher m = TRAILING_INT.matcher(tail);
        if (!m.find()) return 0;
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public static String barcodePayload(String account, LocalDate emissionDate, String visitaCode) {
        return "*" + account + "*" + emissionDate.format(PAYLOAD_DATE) + "*" + visitaCode + "*";
    }

    /**
     * Hands out visita codes for one run. Not thread-safe; it lives on the coordinating thread.
     */
    public static class VisitaTracker {
        private final String documentType;
        private final Map<String, Integer> last;

        VisitaTracker(String documentType, Map<String, Integer> seed) {
            this.documentType = documentType;
            this.last = new HashMap<>(seed);
        }

        public String next(String account) {
            int n = last.getOrDefault(account, 0) + 1;
            last.put(account, n);
            return documentType + n;
        }

        /** The code {@link #next} would return, without consuming it. */
        public String peek(String account) {
            return documentType + (last.getOrDefault(account, 0) + 1);
        }
    }
}
