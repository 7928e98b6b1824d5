package io.validrun.cli;

import io.validrun.runner.CancellationToken;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

final class ShutdownCancellationTest {

    @Test
    void hookCancelsAndWaitsUntilTheRunCloses() throws Exception {
        CancellationToken token = new CancellationToken();
        ShutdownCancellation cancellation = new ShutdownCancellation(token, Duration.ofSeconds(30));
        Thread hook = new Thread(cancellation::cancelAndWait, "test-shutdown");
        hook.start();

        long deadline = System.currentTimeMillis() + 5_000;
        while (!token.isCancelled() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        Assertions.assertTrue(token.isCancelled());
        Thread.sleep(200);
        Assertions.assertTrue(hook.isAlive(), "hook must hold shutdown while the run is still writing");

        cancellation.close();
        hook.join(5_000);
        Assertions.assertFalse(hook.isAlive());
    }

    @Test
    void waitIsBounded() throws Exception {
        CancellationToken token = new CancellationToken();
        ShutdownCancellation cancellation = new ShutdownCancellation(token, Duration.ofMillis(100));
        Thread hook = new Thread(cancellation::cancelAndWait, "test-shutdown");
        hook.start();
        hook.join(5_000);

        Assertions.assertFalse(hook.isAlive());
        Assertions.assertTrue(token.isCancelled());
        cancellation.close();
    }

    @Test
    void installedHookIsRemovedOnClose() {
        ShutdownCancellation cancellation = ShutdownCancellation.install(new CancellationToken(), Duration.ofSeconds(1));
        cancellation.close();
        Assertions.assertFalse(cancellation.token().isCancelled());
    }
}
