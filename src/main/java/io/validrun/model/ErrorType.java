package io.validrun.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorType {
    TIMEOUT("Timeout"),
    SCRIPT_ERROR("ScriptError"),
    RUNNER_ERROR("RunnerError"),
    ABORTED("Aborted");

    private final String wireName;

    ErrorType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
