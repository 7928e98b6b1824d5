package io.validrun.cli;

import io.validrun.runner.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancels the run on JVM shutdown and holds the shutdown until the run has written its Aborted
 * results, bounded by {@code maxWait}. Closing it releases a waiting hook and unregisters it.
 */
final class ShutdownCancellation implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ShutdownCancellation.class);

    private final CancellationToken token;
    private final Duration maxWait;
    private final CountDownLatch finished = new CountDownLatch(1);
    private final Thread hook;

    ShutdownCancellation(CancellationToken token, Duration maxWait) {
        this.token = token;
        this.maxWait = maxWait;
        this.hook = new Thread(this::cancelAndWait, "validrun-cancel");
    }

    static ShutdownCancellation install(CancellationToken token, Duration maxWait) {
        ShutdownCancellation cancellation = new ShutdownCancellation(token, maxWait);
        Runtime.getRuntime().addShutdownHook(cancellation.hook);
        return cancellation;
    }

    CancellationToken token() {
        return token;
    }

    void cancelAndWait() {
        log.warn("Shutdown requested, cancelling the run");
        token.cancel();
        try {
            if (!finished.await(maxWait.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Run did not finish within {} of cancellation", maxWait);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        finished.countDown();
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("Shutdown in progress, cancel hook stays registered");
        }
    }
}
