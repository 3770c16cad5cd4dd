package io.ingestline.api.metrics;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Measures one route: counts each request by status text and records its
 * latency. Methods outside {@code methods} pass through unmeasured.
 */
public final class InstrumentationFilter implements Filter {
    private final String route;
    private final Set<String> methods;
    private final HttpInstrumentation instrumentation;

    public InstrumentationFilter(String route, Set<String> methods, HttpInstrumentation instrumentation) {
        this.route = Objects.requireNonNull(route);
        this.methods = methods.stream().map(m -> m.toUpperCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
        this.instrumentation = Objects.requireNonNull(instrumentation);
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest req)
                || !(response instanceof HttpServletResponse res)
                || !methods.contains(req.getMethod())) {
            chain.doFilter(request, response);
            return;
        }

        long start = System.nanoTime();
        var captured = new StatusCapturingResponse(res);
        boolean completed = false;
        try {
            chain.doFilter(req, captured);
            completed = true;
        } finally {
            // an escaping fault becomes a 500 upstream unless bytes already went out
            int status = completed || captured.isCommitted()
                    ? captured.capturedStatus()
                    : HttpServletResponse.SC_INTERNAL_SERVER_ERROR;
            instrumentation.record(route, req.getMethod(), status, System.nanoTime() - start);
        }
    }
}
