package io.ingestline.store;

import io.ingestline.core.EventCandidate;
import io.ingestline.core.StoredEvent;

import java.util.List;

/**
 * Append-only event storage. The store is the sole owner of event identity and
 * receipt time.
 */
public interface EventStore {

    /**
     * Assigns the next identifier and the current UTC time to {@code candidate}
     * and appends it. An invalid candidate is rejected without consuming an
     * identifier.
     *
     * @throws io.ingestline.core.InvalidEventException if the candidate has no type
     */
    StoredEvent add(EventCandidate candidate);

    /**
     * Up to {@code limit} most recently added events, newest first. A limit of
     * zero or less, or one larger than the store, returns everything.
     */
    List<StoredEvent> list(int limit);

    int size();
}
