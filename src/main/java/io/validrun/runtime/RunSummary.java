package io.validrun.runtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.validrun.model.RunStatus;
import io.validrun.model.RunType;

import java.util.List;

/**
 * What the CLI prints after a run or resume.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record RunSummary(
        String runId,
        RunType runType,
        String target,
        RunStatus status,
        String runFolder,
        String resumeToken,
        String message,
        List<String> warnings
) {
    public RunSummary {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
