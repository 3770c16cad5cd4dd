package io.ingestline.core;

/**
 * An event as submitted by a client: no identifier, no receipt time.
 * A missing payload is treated as the empty string.
 */
public record EventCandidate(String type, String payload) {
    public EventCandidate {
        if (payload == null) payload = "";
    }

    /** Returns this candidate if it carries a non-empty type. */
    public EventCandidate validated() {
        if (type == null || type.isEmpty()) {
            throw new InvalidEventException("missing or empty 'type' (need type, payload)");
        }
        return this;
    }
}
