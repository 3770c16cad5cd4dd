package io.ingestline.store;

import io.ingestline.core.EventCandidate;
import io.ingestline.core.StoredEvent;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Event store backed by a list guarded by this instance's monitor. Nothing is
 * ever evicted; capacity is bounded only by the heap.
 */
public final class InMemoryEventStore implements EventStore {
    private final Clock clock;
    private final List<StoredEvent> events = new ArrayList<>();
    private long sequence;
    private Instant lastReceivedAt = Instant.MIN;

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public synchronized StoredEvent add(EventCandidate candidate) {
        var valid = Objects.requireNonNull(candidate, "candidate").validated();

        // receipt times must not go backwards even if the wall clock does
        Instant now = clock.instant();
        if (now.isBefore(lastReceivedAt)) now = lastReceivedAt;

        var stored = new StoredEvent(sequence + 1, valid.type(), valid.payload(), now);
        events.add(stored);
        sequence = stored.id();
        lastReceivedAt = now;
        return stored;
    }

    @Override
    public synchronized List<StoredEvent> list(int limit) {
        int size = events.size();
        int n = (limit <= 0 || limit > size) ? size : limit;

        var out = new ArrayList<StoredEvent>(n);
        for (int i = size - 1; i >= size - n; i--) {
            out.add(events.get(i));
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public synchronized int size() {
        return events.size();
    }
}
