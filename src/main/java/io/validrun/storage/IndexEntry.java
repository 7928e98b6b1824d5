package io.validrun.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.validrun.model.RunStatus;
import io.validrun.model.RunType;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IndexEntry(
        String runId,
        RunType runType,
        String nodeId,
        String testId,
        String testVersion,
        String suiteId,
        String suiteVersion,
        String planId,
        String planVersion,
        String parentRunId,
        String startTime,
        String endTime,
        RunStatus status
) {
    public static IndexEntry of(CaseResult result, String parentRunId) {
        return new IndexEntry(result.runId(), result.runType(), result.nodeId(), result.testId(), result.testVersion(),
                result.suiteId(), result.suiteVersion(), result.planId(), result.planVersion(), parentRunId,
                result.startTime(), result.endTime(), result.status());
    }

    public static IndexEntry of(GroupResult result, String parentRunId) {
        return new IndexEntry(result.runId(), result.runType(), result.nodeId(), null, null,
                result.suiteId(), result.suiteVersion(), result.planId(), result.planVersion(), parentRunId,
                result.startTime(), result.endTime(), result.status());
    }
}
