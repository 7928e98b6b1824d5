package io.validrun.runner;

import io.validrun.security.SecretRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one external process to completion.
 *
 * <p>Four independent tasks race: the stdout pump, the stderr pump, the exit wait and the
 * timeout timer, plus the cancellation signal. The first of exit/timeout/cancel decides the
 * outcome. Cleanup always follows: kill the tree when needed, wait for the real exit, drain pumps.
 */
public final class ProcessSupervisor {
    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);
    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    private enum Decision {
        EXITED,
        TIMED_OUT,
        CANCELLED
    }

    private final ProcessTreeKiller killer;
    private final Duration drainTimeout;

    public ProcessSupervisor(Duration killGrace) {
        this.killer = new ProcessTreeKiller(killGrace);
        this.drainTimeout = killGrace.multipliedBy(2);
    }

    public ProcessOutcome run(
            List<String> command,
            Path workingDir,
            Map<String, String> environment,
            Path stdoutLog,
            Path stderrLog,
            Duration timeout,
            CancellationToken cancellation,
            SecretRedactor redactor
    ) {
        Instant start = Instant.now();
        if (cancellation.isCancelled()) {
            return new ProcessOutcome(null, false, true, null, List.of(), start, start);
        }
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.directory(workingDir.toFile());
        builder.environment().putAll(environment);
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.error("Failed to start {}: {}", command.get(0), e.getMessage());
            return ProcessOutcome.startFailed(e.getMessage(), start);
        }
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of pid {}: {}", process.pid(), e.getMessage());
        }
        log.debug("Started pid {} in {}", process.pid(), workingDir);

        ExecutorService pumps = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "validrun-pump-" + THREAD_SEQ.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            CompletableFuture<Void> stdout = CompletableFuture.runAsync(
                    new StreamPump("stdout", process.getInputStream(), stdoutLog, redactor), pumps);
            CompletableFuture<Void> stderr = CompletableFuture.runAsync(
                    new StreamPump("stderr", process.getErrorStream(), stderrLog, redactor), pumps);

            CompletableFuture<Decision> exited = process.onExit().thenApply(p -> Decision.EXITED);
            CompletableFuture<Decision> timer = new CompletableFuture<>();
            if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
                timer.completeOnTimeout(Decision.TIMED_OUT, timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            CompletableFuture<Decision> cancelled = cancellation.onCancel().thenApply(v -> Decision.CANCELLED);

            Decision decision = (Decision) CompletableFuture.anyOf(exited, timer, cancelled).join();
            timer.cancel(false);

            List<Long> survivors = List.of();
            if (decision != Decision.EXITED) {
                log.warn("Process {} {}, terminating tree", process.pid(),
                        decision == Decision.TIMED_OUT ? "timed out after " + timeout : "cancelled");
                survivors = killer.killTree(process.toHandle());
            }
            Integer exitCode = awaitExitCode(process);
            drain(process, stdout, stderr);
            return new ProcessOutcome(
                    exitCode,
                    decision == Decision.TIMED_OUT,
                    decision == Decision.CANCELLED,
                    null,
                    survivors,
                    start,
                    Instant.now()
            );
        } finally {
            pumps.shutdownNow();
        }
    }

    private Integer awaitExitCode(Process process) {
        try {
            if (process.waitFor(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return process.exitValue();
            }
            log.error("Process {} did not exit after termination", process.pid());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    private void drain(Process process, CompletableFuture<Void> stdout, CompletableFuture<Void> stderr) {
        try {
            CompletableFuture.allOf(stdout, stderr).get(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // A surviving grandchild can hold the pipes open; close our ends so the pumps finish.
            log.warn("Output pumps of pid {} did not drain, closing streams", process.pid());
            closeQuietly(process);
        } catch (ExecutionException e) {
            log.warn("Output pump of pid {} failed: {}", process.pid(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void closeQuietly(Process process) {
        try {
            process.getInputStream().close();
            process.getErrorStream().close();
        } catch (IOException e) {
            log.warn("Failed to close streams of pid {}: {}", process.pid(), e.getMessage());
        }
    }
}
