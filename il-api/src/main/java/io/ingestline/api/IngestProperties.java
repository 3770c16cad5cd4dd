package io.ingestline.api;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * @param requestTimeout ceiling on handler execution; a request still running
 *                       past it is answered with 504
 */
@ConfigurationProperties(prefix = "ingest")
public record IngestProperties(@DefaultValue("30s") Duration requestTimeout) {}
