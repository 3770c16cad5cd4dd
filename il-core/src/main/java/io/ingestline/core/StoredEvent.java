package io.ingestline.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * An event as held by the store. {@code id} and {@code receivedAt} are assigned
 * by the store and never taken from the client.
 */
public record StoredEvent(
        long id,
        String type,
        String payload,
        @JsonProperty("received_at") Instant receivedAt
) {
    public StoredEvent {
        Objects.requireNonNull(type);
        Objects.requireNonNull(payload);
        Objects.requireNonNull(receivedAt);
    }
}
