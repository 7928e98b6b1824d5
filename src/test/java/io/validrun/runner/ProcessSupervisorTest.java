package io.validrun.runner;

import io.validrun.Fixtures;
import io.validrun.security.SecretRedactor;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

@DisabledOnOs(OS.WINDOWS)
final class ProcessSupervisorTest {
    private final ProcessSupervisor supervisor = new ProcessSupervisor(Duration.ofSeconds(1));

    @Test
    void capturesStreamsExitCodeAndRedactsSecrets() throws Exception {
        Path root = Files.createTempDirectory("validrun-supervisor-");
        try {
            Path script = Fixtures.write(root.resolve("run.sh"), """
                    echo "token is $LAB_TOKEN"
                    echo "oops" 1>&2
                    exit 2
                    """);
            ProcessOutcome outcome = run(root, script, Map.of("LAB_TOKEN", "tok-123"), null, new CancellationToken(),
                    new SecretRedactor(List.of("tok-123")));

            Assertions.assertEquals(Integer.valueOf(2), outcome.exitCode());
            Assertions.assertFalse(outcome.timedOut());
            Assertions.assertEquals("token is ***", Files.readString(root.resolve("stdout.log"), StandardCharsets.UTF_8).trim());
            Assertions.assertEquals("oops", Files.readString(root.resolve("stderr.log"), StandardCharsets.UTF_8).trim());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void timeoutKillsWholeTreeEvenAfterSelfReportedSuccess() throws Exception {
        Path root = Files.createTempDirectory("validrun-supervisor-timeout-");
        try {
            Path script = Fixtures.write(root.resolve("run.sh"), """
                    echo "PASSED"
                    sleep 60 &
                    echo $! > child.pid
                    wait
                    exit 0
                    """);
            long started = System.nanoTime();
            ProcessOutcome outcome = run(root, script, Map.of(), Duration.ofSeconds(1), new CancellationToken(),
                    SecretRedactor.none());
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            Assertions.assertTrue(outcome.timedOut());
            Assertions.assertTrue(elapsedMs < 15_000, "took " + elapsedMs + "ms");
            long childPid = Long.parseLong(Files.readString(root.resolve("child.pid"), StandardCharsets.UTF_8).trim());
            Assertions.assertFalse(running(childPid), "grandchild " + childPid + " still running");
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void cancellationAbortsRunningProcess() throws Exception {
        Path root = Files.createTempDirectory("validrun-supervisor-cancel-");
        try {
            Path script = Fixtures.write(root.resolve("run.sh"), "sleep 60\n");
            CancellationToken token = new CancellationToken();
            CompletableFuture.delayedExecutor(300, TimeUnit.MILLISECONDS).execute(token::cancel);

            ProcessOutcome outcome = run(root, script, Map.of(), Duration.ofSeconds(30), token, SecretRedactor.none());

            Assertions.assertTrue(outcome.aborted());
            Assertions.assertFalse(outcome.timedOut());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void alreadyCancelledTokenNeverStartsTheProcess() throws Exception {
        Path root = Files.createTempDirectory("validrun-supervisor-precancel-");
        try {
            Path script = Fixtures.write(root.resolve("run.sh"), "touch started\n");
            CancellationToken token = new CancellationToken();
            token.cancel();

            ProcessOutcome outcome = run(root, script, Map.of(), null, token, SecretRedactor.none());

            Assertions.assertTrue(outcome.aborted());
            Assertions.assertFalse(Files.exists(root.resolve("started")));
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void missingInterpreterIsStartFailure() throws Exception {
        Path root = Files.createTempDirectory("validrun-supervisor-nostart-");
        try {
            ProcessOutcome outcome = supervisor.run(List.of(root.resolve("no-such-binary").toString()), root, Map.of(),
                    root.resolve("stdout.log"), root.resolve("stderr.log"), null, new CancellationToken(),
                    SecretRedactor.none());
            Assertions.assertFalse(outcome.started());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    // An orphan killed under a non-reaping init lingers as a zombie; that counts as stopped.
    private static boolean running(long pid) throws Exception {
        Path stat = Path.of("/proc", Long.toString(pid), "stat");
        if (Files.isRegularFile(stat)) {
            try {
                String raw = Files.readString(stat, StandardCharsets.UTF_8);
                char state = raw.charAt(raw.lastIndexOf(')') + 2);
                return state != 'Z' && state != 'X';
            } catch (NoSuchFileException e) {
                return false;
            }
        }
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    private ProcessOutcome run(Path root, Path script, Map<String, String> env, Duration timeout,
                               CancellationToken token, SecretRedactor redactor) {
        return supervisor.run(List.of("/bin/sh", script.toString()), root, env, root.resolve("stdout.log"),
                root.resolve("stderr.log"), timeout, token, redactor);
    }
}
