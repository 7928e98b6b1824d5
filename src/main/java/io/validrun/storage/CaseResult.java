package io.validrun.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import io.validrun.model.RunStatus;
import io.validrun.model.RunType;

import java.util.Map;

/**
 * Contents of a case run's result.json. Written by the engine only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CaseResult(
        String schemaVersion,
        String runId,
        RunType runType,
        String nodeId,
        String testId,
        String testVersion,
        String suiteId,
        String suiteVersion,
        String planId,
        String planVersion,
        RunStatus status,
        String startTime,
        String endTime,
        Integer exitCode,
        Integer phase,
        JsonNode effectiveInputs,
        RunError error,
        Map<String, Object> runner,
        String message
) {
    public static final String SCHEMA_VERSION = "1.0.0";

    /**
     * Copy that closes a suspended result with a terminal status.
     */
    public CaseResult terminated(RunStatus newStatus, RunError newError, String newEndTime, String newMessage) {
        return new CaseResult(schemaVersion, runId, runType, nodeId, testId, testVersion, suiteId, suiteVersion,
                planId, planVersion, newStatus, startTime, newEndTime, exitCode, phase, effectiveInputs, newError,
                runner, newMessage);
    }
}
