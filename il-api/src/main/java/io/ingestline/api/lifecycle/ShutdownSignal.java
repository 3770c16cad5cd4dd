package io.ingestline.api.lifecycle;

import java.util.concurrent.CountDownLatch;

/** One-shot cancellation token that starts the shutdown sequence. */
public final class ShutdownSignal {
    private final CountDownLatch latch = new CountDownLatch(1);

    public void trigger() {
        latch.countDown();
    }

    public boolean isTriggered() {
        return latch.getCount() == 0;
    }

    public void await() throws InterruptedException {
        latch.await();
    }
}
