package io.ingestline.api.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.http.HttpStatus;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide request metrics: a counter labelled by route, method and status
 * text, and a latency histogram labelled by route and method.
 *
 * <p>Exported by a Prometheus registry as {@code http_requests_total} and
 * {@code http_request_duration_seconds}.
 */
public final class HttpInstrumentation {

    public static final String REQUESTS = "http.requests";
    public static final String DURATION = "http.request.duration";

    private static final Duration[] BUCKETS = {
            Duration.ofMillis(5), Duration.ofMillis(10), Duration.ofMillis(25),
            Duration.ofMillis(50), Duration.ofMillis(100), Duration.ofMillis(250),
            Duration.ofMillis(500), Duration.ofSeconds(1), Duration.ofMillis(2500),
            Duration.ofSeconds(5), Duration.ofSeconds(10)
    };

    private final MeterRegistry registry;

    public HttpInstrumentation(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry);
    }

    public void record(String route, String method, int status, long elapsedNanos) {
        Counter.builder(REQUESTS)
                .description("Total HTTP requests")
                .tags("route", route, "method", method, "code", statusText(status))
                .register(registry)
                .increment();

        Timer.builder(DURATION)
                .description("HTTP request latency")
                .tags("route", route, "method", method)
                .serviceLevelObjectives(BUCKETS)
                .register(registry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    /** Requests seen for a route and method, summed over every status label. */
    public double requestCount(String route, String method) {
        return registry.find(REQUESTS).tags("route", route, "method", method)
                .counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    public double requestCount(String route, String method, int status) {
        var counter = registry.find(REQUESTS)
                .tags("route", route, "method", method, "code", statusText(status))
                .counter();
        return counter == null ? 0 : counter.count();
    }

    public long latencyCount(String route, String method) {
        var timer = registry.find(DURATION).tags("route", route, "method", method).timer();
        return timer == null ? 0 : timer.count();
    }

    public MeterRegistry registry() {
        return registry;
    }

    /** Reason phrase for {@code status}, empty for codes HTTP does not define. */
    static String statusText(int status) {
        var resolved = HttpStatus.resolve(status);
        return resolved == null ? "" : resolved.getReasonPhrase();
    }
}
