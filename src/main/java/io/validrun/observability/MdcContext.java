package io.validrun.observability;

import org.slf4j.MDC;

/**
 * MDC keys attached to log lines while a run executes.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setCase(String runId, String nodeId, int phase) {
        MDC.put("runId", runId);
        if (nodeId != null) {
            MDC.put("nodeId", nodeId);
        }
        MDC.put("phase", String.valueOf(phase));
    }

    public static void clearCase() {
        MDC.remove("nodeId");
        MDC.remove("phase");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("nodeId");
        MDC.remove("phase");
    }
}
