package io.validrun.runner;

import java.util.concurrent.CompletableFuture;

/**
 * User-initiated abort. Supervisors race it against process exit and the timeout timer.
 */
public final class CancellationToken {
    private final CompletableFuture<Void> signal = new CompletableFuture<>();

    public void cancel() {
        signal.complete(null);
    }

    public boolean isCancelled() {
        return signal.isDone();
    }

    public CompletableFuture<Void> onCancel() {
        return signal;
    }
}
