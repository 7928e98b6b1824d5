package io.validrun.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.validrun.model.RunStatus;
import io.validrun.model.RunType;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GroupResult(
        String schemaVersion,
        String runId,
        RunType runType,
        String nodeId,
        String suiteId,
        String suiteVersion,
        String planId,
        String planVersion,
        RunStatus status,
        String startTime,
        String endTime,
        Map<String, Integer> counts,
        List<String> childRunIds,
        String message
) {
    public GroupResult {
        counts = counts == null ? Map.of() : Map.copyOf(counts);
        childRunIds = childRunIds == null ? List.of() : List.copyOf(childRunIds);
    }

    public GroupResult withStatus(RunStatus newStatus, String newEndTime, String newMessage) {
        return new GroupResult(schemaVersion, runId, runType, nodeId, suiteId, suiteVersion, planId, planVersion,
                newStatus, startTime, newEndTime, counts, childRunIds, newMessage);
    }
}
