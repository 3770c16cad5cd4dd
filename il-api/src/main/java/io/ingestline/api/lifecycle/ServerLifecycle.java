package io.ingestline.api.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.web.context.WebServerApplicationContext;
import org.springframework.context.ConfigurableApplicationContext;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives the process through {@code STARTING -> RUNNING -> SHUTTING_DOWN -> STOPPED}.
 *
 * <p>The embedded server accepts connections on its own threads once
 * {@link #start} returns; the caller then blocks on the {@link ShutdownSignal}.
 * Closing the context performs Spring Boot's graceful shutdown: the listening
 * socket is closed at once, in-flight requests get up to
 * {@code spring.lifecycle.timeout-per-shutdown-phase} to finish, and whatever is
 * left after that is cut off.
 */
public final class ServerLifecycle {
    private static final Logger log = LoggerFactory.getLogger(ServerLifecycle.class);

    public enum State { STARTING, RUNNING, SHUTTING_DOWN, STOPPED }

    private final SpringApplication application;
    private final ShutdownSignal signal;
    private final AtomicReference<State> state = new AtomicReference<>(State.STARTING);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile ConfigurableApplicationContext context;
    private volatile boolean started;

    public ServerLifecycle(SpringApplication application, ShutdownSignal signal) {
        this.application = Objects.requireNonNull(application);
        this.signal = Objects.requireNonNull(signal);
        // this class owns shutdown ordering, not Spring's JVM hook
        application.setRegisterShutdownHook(false);
    }

    /** Starts, waits for the signal, then shuts down. */
    public void run(String... args) throws InterruptedException {
        start(args);
        signal.await();
        shutdown();
    }

    /**
     * Brings the server up.
     *
     * @throws ServerStartupException if the context fails to start, including
     *                                when the listen address cannot be bound
     */
    public void start(String... args) {
        if (state.get() != State.STARTING) {
            throw new IllegalStateException("Cannot start from " + state.get());
        }
        try {
            context = application.run(args);
        } catch (RuntimeException e) {
            state.set(State.STOPPED);
            stopped.countDown();
            throw new ServerStartupException("Unable to start HTTP listener: " + e.getMessage(), e);
        }
        started = true;
        state.set(State.RUNNING);
        log.info("Running, listening on port {}", localPort());
    }

    /** Stops accepting connections and drains in-flight requests. No-op unless running. */
    public void shutdown() {
        if (!state.compareAndSet(State.RUNNING, State.SHUTTING_DOWN)) return;
        log.info("Shutting down, draining in-flight requests");
        try {
            context.close();
        } catch (RuntimeException e) {
            log.warn("Error while closing server", e);
        } finally {
            state.set(State.STOPPED);
            log.info("Stopped");
            stopped.countDown();
        }
    }

    /**
     * Registers a JVM shutdown hook (SIGINT, SIGTERM) that triggers the signal,
     * waits up to {@code bound} for STOPPED, and then ends the process with the
     * status from {@link #terminate}.
     */
    public void installTerminationHook(Duration bound) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            int status;
            try {
                status = terminate(bound);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                status = 1;
            }
            // the logging hook is disabled, so nothing else is left to flush
            if (status >= 0) Runtime.getRuntime().halt(status);
        }, "termination-hook"));
    }

    /**
     * Requests shutdown and waits for it. Returns 0 once a started server has
     * drained, 1 if it did not stop within {@code bound}, and -1 if it never
     * started, in which case the exit status is left to whoever called exit.
     */
    int terminate(Duration bound) throws InterruptedException {
        signal.trigger();
        if (!awaitStopped(bound)) {
            log.warn("Shutdown did not complete within {}", bound);
            return 1;
        }
        return started ? 0 : -1;
    }

    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public State state() {
        return state.get();
    }

    public ShutdownSignal signal() {
        return signal;
    }

    public ConfigurableApplicationContext context() {
        return context;
    }

    /** Actual bound port, or -1 when not running a web server. */
    public int localPort() {
        if (context instanceof WebServerApplicationContext web && web.getWebServer() != null) {
            return web.getWebServer().getPort();
        }
        return -1;
    }
}
