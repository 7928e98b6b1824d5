package io.validrun.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RunStatus {
    PASSED("Passed"),
    FAILED("Failed"),
    ERROR("Error"),
    TIMEOUT("Timeout"),
    ABORTED("Aborted"),
    REBOOT_REQUIRED("RebootRequired");

    private final String wireName;

    RunStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Statuses a retry may re-execute.
     */
    public boolean retryable() {
        return this == ERROR || this == TIMEOUT;
    }

    @JsonCreator
    public static RunStatus fromString(String raw) {
        if (raw != null) {
            for (RunStatus value : values()) {
                if (value.wireName.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("Unknown run status: " + raw);
    }
}
