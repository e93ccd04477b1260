package com.alertrelay.core.store;

import com.alertrelay.core.check.CheckRun;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link CheckRunStore} kept in a synchronized list.
 *
 * @since 1.0.0
 */
public class InMemoryCheckRunStore implements CheckRunStore {

    private final Clock clock;
    private final List<CheckRun> runs = new ArrayList<>();
    private long seq;

    public InMemoryCheckRunStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public synchronized CheckRun record(CheckRun run) {
        Objects.requireNonNull(run, "run must not be null");
        CheckRun saved = run.withIdentity(++seq, clock.instant());
        runs.add(saved);
        return saved;
    }

    @Override
    public synchronized List<CheckRun> findByTraceId(String traceId) {
        return runs.stream()
                .filter(r -> Objects.equals(traceId, r.getTraceId()))
                .toList();
    }

    @Override
    public synchronized List<CheckRun> findAll() {
        return List.copyOf(runs);
    }
}
