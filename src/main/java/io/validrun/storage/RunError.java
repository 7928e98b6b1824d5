package io.validrun.storage;

import io.validrun.model.ErrorType;

public record RunError(ErrorType type, String source, String message) {
    public static RunError runner(String message) {
        return new RunError(ErrorType.RUNNER_ERROR, "Runner", message);
    }

    public static RunError script(String message) {
        return new RunError(ErrorType.SCRIPT_ERROR, "Script", message);
    }

    public static RunError timeout(String message) {
        return new RunError(ErrorType.TIMEOUT, "Runner", message);
    }

    public static RunError aborted(String message) {
        return new RunError(ErrorType.ABORTED, "Runner", message);
    }
}
