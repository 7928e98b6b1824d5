package io.validrun.runtime;

import io.validrun.model.RunStatus;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rolls child statuses up into a suite or plan status.
 */
public final class StatusAggregator {
    private static final List<RunStatus> PRECEDENCE = List.of(
            RunStatus.ERROR, RunStatus.TIMEOUT, RunStatus.FAILED, RunStatus.ABORTED
    );

    private StatusAggregator() {
    }

    public static RunStatus aggregate(Collection<RunStatus> children, boolean cancelled) {
        if (cancelled) {
            return RunStatus.ABORTED;
        }
        for (RunStatus candidate : PRECEDENCE) {
            if (children.contains(candidate)) {
                return candidate;
            }
        }
        return RunStatus.PASSED;
    }

    public static Map<String, Integer> counts(Collection<RunStatus> children) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (RunStatus status : RunStatus.values()) {
            counts.put(status.wireName(), 0);
        }
        for (RunStatus child : children) {
            counts.merge(child.wireName(), 1, Integer::sum);
        }
        return counts;
    }
}
