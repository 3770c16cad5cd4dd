package io.ingestline.api;

import io.ingestline.api.lifecycle.ServerLifecycle;
import io.ingestline.api.lifecycle.ServerStartupException;
import io.ingestline.api.lifecycle.ShutdownSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.time.Duration;

@SpringBootApplication
public class IngestApplication {
    private static final Logger log = LoggerFactory.getLogger(IngestApplication.class);

    /** Shutdown grace period (10s) plus room for closing the context. */
    static final Duration TERMINATION_WAIT = Duration.ofSeconds(15);

    public static void main(String[] args) throws InterruptedException {
        var lifecycle = new ServerLifecycle(new SpringApplication(IngestApplication.class), new ShutdownSignal());
        lifecycle.installTerminationHook(TERMINATION_WAIT);
        try {
            lifecycle.run(args);
        } catch (ServerStartupException e) {
            log.error("Fatal: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
