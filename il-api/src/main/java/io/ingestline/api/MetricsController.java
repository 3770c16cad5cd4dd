package io.ingestline.api;

import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Prometheus scrape endpoint. Not instrumented. */
@RestController
public class MetricsController {
    static final String CONTENT_TYPE_004 = "text/plain; version=0.0.4; charset=utf-8";

    private final PrometheusMeterRegistry registry;

    public MetricsController(PrometheusMeterRegistry registry) {
        this.registry = registry;
    }

    @GetMapping(path = "/metrics", produces = CONTENT_TYPE_004)
    public String scrape() {
        return registry.scrape();
    }
}
