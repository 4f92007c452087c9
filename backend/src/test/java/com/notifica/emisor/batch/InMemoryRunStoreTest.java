package com.notifica.emisor.batch;

import com.notifica.emisor.batch.EmissionRunModels.EmissionRun;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRunStoreTest {

    @Test
    void evictsOnlyRunsFinishedBeforeCutoff() {
        InMemoryRunStore store = new InMemoryRunStore();
        Instant cutoff = Instant.parse("2024-06-01T00:00:00Z");

        EmissionRun old = new EmissionRun("old");
        old.finishedAt = cutoff.minusSeconds(60);
        EmissionRun recent = new EmissionRun("recent");
        recent.finishedAt = cutoff.plusSeconds(60);
        EmissionRun running = new EmissionRun("running");

        store.put(old);
        store.put(recent);
        store.put(running);
        store.evictFinishedBefore(cutoff);

        assertThat(store.get("old")).isNull();
        assertThat(store.get("recent")).isSameAs(recent);
        assertThat(store.get("running")).isSameAs(running);
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void unknownOrNullSessionReturnsNull() {
        InMemoryRunStore store = new InMemoryRunStore();
        assertThat(store.get(null)).isNull();
        assertThat(store.get("missing")).isNull();
    }
}
