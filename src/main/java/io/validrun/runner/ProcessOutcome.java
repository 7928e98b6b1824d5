package io.validrun.runner;

import java.time.Instant;
import java.util.List;

/**
 * What the supervisor observed. Status derivation happens in {@link StatusMapper}.
 */
public record ProcessOutcome(
        Integer exitCode,
        boolean timedOut,
        boolean aborted,
        String startError,
        List<Long> survivingPids,
        Instant startTime,
        Instant endTime
) {
    public ProcessOutcome {
        survivingPids = survivingPids == null ? List.of() : List.copyOf(survivingPids);
    }

    public static ProcessOutcome startFailed(String error, Instant at) {
        return new ProcessOutcome(null, false, false, error, List.of(), at, at);
    }

    public boolean started() {
        return startError == null;
    }
}
