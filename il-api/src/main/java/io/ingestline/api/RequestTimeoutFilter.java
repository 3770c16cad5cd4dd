package io.ingestline.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Bounds how long a handler may run. At the deadline the worker thread is
 * interrupted, which is the cancellation signal for that request only. Once the
 * handler returns, an uncommitted response is replaced with a 504.
 */
@Component
@Order(PipelineOrder.TIMEOUT)
public class RequestTimeoutFilter implements Filter, DisposableBean {
    private static final Logger log = LoggerFactory.getLogger(RequestTimeoutFilter.class);

    private final Duration timeout;
    private final ObjectMapper json;
    private final ScheduledExecutorService timer;

    @Autowired
    public RequestTimeoutFilter(IngestProperties properties, ObjectMapper json) {
        this(properties.requestTimeout(), json);
    }

    RequestTimeoutFilter(Duration timeout, ObjectMapper json) {
        this.timeout = timeout;
        this.json = json;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "request-timeout");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        var deadline = new Deadline(Thread.currentThread());
        ScheduledFuture<?> expiry = timer.schedule(deadline::expire, timeout.toNanos(), TimeUnit.NANOSECONDS);
        try {
            chain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException e) {
            if (!deadline.finish()) throw e;
            log.debug("Handler failed after its deadline", e);
        } finally {
            expiry.cancel(false);
            if (deadline.finish()) timedOut((HttpServletRequest) request, (HttpServletResponse) response);
        }
    }

    private void timedOut(HttpServletRequest req, HttpServletResponse res) throws IOException {
        log.warn("Request exceeded {} method={} path={}", timeout, req.getMethod(), req.getRequestURI());
        if (res.isCommitted()) return;
        ErrorResponses.write(json, req, res, HttpStatus.GATEWAY_TIMEOUT, "request timed out");
    }

    @Override
    public void destroy() {
        timer.shutdownNow();
    }

    /**
     * Expiry and completion race; both go through this monitor so an interrupt
     * can never land after the request has finished with the thread.
     */
    private static final class Deadline {
        private final Thread worker;
        private boolean finished;
        private boolean expired;

        Deadline(Thread worker) {
            this.worker = worker;
        }

        synchronized void expire() {
            if (finished) return;
            expired = true;
            worker.interrupt();
        }

        /** Marks the request done, clears a pending interrupt, and reports whether the deadline passed. */
        synchronized boolean finish() {
            if (!finished) {
                finished = true;
                if (expired) Thread.interrupted();
            }
            return expired;
        }
    }
}
