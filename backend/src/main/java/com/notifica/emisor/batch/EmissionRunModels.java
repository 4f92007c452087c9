package com.notifica.emisor.batch;

import com.notifica.emisor.dto.EmissionRunSummary;
import com.notifica.emisor.dto.RecordError;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

public class EmissionRunModels {

    public enum RunState {
        CREATED, CSV_LOADED, MATCHED, BATCHES_DISPATCHED, AGGREGATED, DONE, FAILED, CANCELLED;

        public boolean isTerminal() {
            return this == DONE || this == FAILED || this == CANCELLED;
        }
    }

    private static final Map<RunState, Set<RunState>> TRANSITIONS = Map.of(
            RunState.CREATED, EnumSet.of(RunState.CSV_LOADED, RunState.FAILED, RunState.CANCELLED),
            RunState.CSV_LOADED, EnumSet.of(RunState.MATCHED, RunState.FAILED, RunState.CANCELLED),
            RunState.MATCHED, EnumSet.of(RunState.BATCHES_DISPATCHED, RunState.CANCELLED),
            RunState.BATCHES_DISPATCHED, EnumSet.of(RunState.AGGREGATED),
            RunState.AGGREGATED, EnumSet.of(RunState.DONE)
    );

    public static boolean canTransition(RunState from, RunState to) {
        return TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    public static class EmissionRun {
        public final String sessionId;
        private volatile RunState state = RunState.CREATED;
        public volatile boolean cancelRequested;
        public final AtomicInteger total = new AtomicInteger(0);
        public final AtomicInteger rendered = new AtomicInteger(0);
        public final AtomicInteger failed = new AtomicInteger(0);
        public volatile Instant startedAt;
        public volatile Instant finishedAt;
        public volatile String failureMessage;
        public volatile EmissionRunSummary summary;
        public final List<RecordError> errors = Collections.synchronizedList(new ArrayList<>());

        public EmissionRun() {
            this(UUID.randomUUID().toString());
        }

        public EmissionRun(String sessionId) {
            this.sessionId = sessionId;
        }

        public RunState getState() { return state; }

        /** Moves the run forward; only the edges of the run lifecycle are accepted. */
        public synchronized void transition(RunState next) {
            if (!canTransition(state, next)) {
                throw new IllegalStateException("Run " + sessionId + " cannot move from " + state + " to " + next);
            }
            state = next;
        }

        public boolean isBeforeMatch() {
            return state == RunState.CREATED || state == RunState.CSV_LOADED;
        }
    }
}
