package io.validrun.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Raw suite controls. Unset fields stay null so plan-level overrides can be layered.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SuiteControls(
        Integer repeat,
        Integer maxParallel,
        Boolean continueOnFailure,
        Integer retryOnError,
        String timeoutPolicy
) {
    public static final SuiteControls DEFAULTS = new SuiteControls(1, 1, false, 0, "AbortOnTimeout");

    public static SuiteControls empty() {
        return new SuiteControls(null, null, null, null, null);
    }

    public int effectiveRepeat() {
        return repeat == null ? 1 : Math.max(1, repeat);
    }

    public int effectiveMaxParallel() {
        return maxParallel == null ? 1 : Math.max(1, maxParallel);
    }

    public boolean effectiveContinueOnFailure() {
        return continueOnFailure != null && continueOnFailure;
    }

    public int effectiveRetryOnError() {
        return retryOnError == null ? 0 : Math.max(0, retryOnError);
    }

    public String effectiveTimeoutPolicy() {
        return timeoutPolicy == null || timeoutPolicy.isBlank() ? "AbortOnTimeout" : timeoutPolicy;
    }

    public SuiteControls overriddenBy(SuiteControls override) {
        if (override == null) {
            return this;
        }
        return new SuiteControls(
                override.repeat != null ? override.repeat : repeat,
                override.maxParallel != null ? override.maxParallel : maxParallel,
                override.continueOnFailure != null ? override.continueOnFailure : continueOnFailure,
                override.retryOnError != null ? override.retryOnError : retryOnError,
                override.timeoutPolicy != null ? override.timeoutPolicy : timeoutPolicy
        );
    }

    /**
     * Fully populated copy, as written to controls.json.
     */
    public SuiteControls resolved() {
        return new SuiteControls(effectiveRepeat(), effectiveMaxParallel(), effectiveContinueOnFailure(),
                effectiveRetryOnError(), effectiveTimeoutPolicy());
    }
}
