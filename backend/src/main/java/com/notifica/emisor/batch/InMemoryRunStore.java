package com.notifica.emisor.batch;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryRunStore {

    static final Duration RETENTION = Duration.ofHours(24);

    private final Map<String, EmissionRunModels.EmissionRun> runs = new ConcurrentHashMap<>();

    public void put(EmissionRunModels.EmissionRun run) {
        runs.put(run.sessionId, run);
    }

    public EmissionRunModels.EmissionRun get(String sessionId) {
        return sessionId == null ? null : runs.get(sessionId);
    }

    public int size() {
        return runs.size();
    }

    @Scheduled(cron = "0 0 * * * *") // hourly cleanup
    public void cleanup() {
        evictFinishedBefore(Instant.now().minus(RETENTION));
    }

    void evictFinishedBefore(Instant cutoff) {
        runs.values().removeIf(r -> r.finishedAt != null && r.finishedAt.isBefore(cutoff));
    }
}
