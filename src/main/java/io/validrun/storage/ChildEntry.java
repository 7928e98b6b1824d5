package io.validrun.storage;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.validrun.model.RunStatus;
import io.validrun.model.RunType;

/**
 * One line of children.jsonl. Aborted siblings that never started carry no runId.
 * Every retry attempt gets its own line; superseded attempts are marked {@code retried}
 * and do not count towards the group status.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChildEntry(
        String runId,
        RunType runType,
        String nodeId,
        String identity,
        int iteration,
        Integer attempt,
        Boolean retried,
        RunStatus status,
        String message
) {
    @JsonIgnore
    public boolean counted() {
        return !Boolean.TRUE.equals(retried);
    }
}
