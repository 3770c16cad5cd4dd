package io.ingestline.api;

import java.time.Instant;

/** Structured error body returned for every 4xx/5xx the service produces itself. */
public record ErrorPayload(Instant timestamp, int status, String error, String message, String path) {}
