package io.ingestline.api.lifecycle;

/** The listener could not be brought up. Not retried. */
public class ServerStartupException extends RuntimeException {
    public ServerStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
