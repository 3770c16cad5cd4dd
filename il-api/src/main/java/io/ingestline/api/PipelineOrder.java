package io.ingestline.api;

import org.springframework.core.Ordered;

/** Filter positions in the request pipeline, outermost first. */
public final class PipelineOrder {
    public static final int RECOVERY = Ordered.HIGHEST_PRECEDENCE + 10;
    public static final int REQUEST_ID = RECOVERY + 10;
    public static final int CLIENT_ADDRESS = REQUEST_ID + 10;
    public static final int TIMEOUT = CLIENT_ADDRESS + 10;
    public static final int ACCESS_LOG = TIMEOUT + 10;
    public static final int INSTRUMENTATION = Ordered.LOWEST_PRECEDENCE - 10;

    private PipelineOrder() {}
}
