package io.validrun.runner;

import io.validrun.model.RunStatus;
import io.validrun.storage.RunError;

/**
 * Authoritative status from what the supervisor observed. Anything a script prints or writes
 * into its artifacts is evidence only and never consulted here.
 */
public final class StatusMapper {
    private StatusMapper() {
    }

    public static Derived derive(ProcessOutcome outcome, long timeoutSec) {
        Derived derived = deriveStatus(outcome, timeoutSec);
        if (!outcome.survivingPids().isEmpty()) {
            String note = "process tree survived termination: " + outcome.survivingPids();
            RunError error = derived.error() == null
                    ? RunError.runner(note)
                    : new RunError(derived.error().type(), derived.error().source(), derived.error().message() + "; " + note);
            return new Derived(derived.status(), error);
        }
        return derived;
    }

    private static Derived deriveStatus(ProcessOutcome outcome, long timeoutSec) {
        if (!outcome.started()) {
            return new Derived(RunStatus.ERROR, RunError.runner("Failed to start interpreter: " + outcome.startError()));
        }
        if (outcome.timedOut()) {
            return new Derived(RunStatus.TIMEOUT, RunError.timeout("Timed out after " + timeoutSec + "s"));
        }
        if (outcome.aborted()) {
            return new Derived(RunStatus.ABORTED, RunError.aborted("Run was cancelled"));
        }
        return fromExitCode(outcome.exitCode());
    }

    public static Derived fromExitCode(Integer exitCode) {
        if (exitCode == null) {
            return new Derived(RunStatus.ERROR, RunError.runner("Process exit code is unavailable"));
        }
        return switch (exitCode) {
            case 0 -> new Derived(RunStatus.PASSED, null);
            case 1 -> new Derived(RunStatus.FAILED, null);
            default -> new Derived(RunStatus.ERROR, RunError.script("Script exited with code " + exitCode));
        };
    }

    public record Derived(RunStatus status, RunError error) {
    }
}
