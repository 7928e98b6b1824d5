package io.validrun.reboot;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import io.validrun.model.RunType;

/**
 * Persisted continuation of a suspended run, stored as session.json in the top-level run folder.
 * The file is the resume point; nothing about a suspension lives only in memory.
 *
 * @param caseRunId     run folder of the case that asked for the reboot
 * @param suitePosition index of the suite inside a plan, null for suite and case runs
 * @param nodePosition  index of the case node inside its suite
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResumeSession(
        String runId,
        RunType runType,
        String target,
        State state,
        int nextPhase,
        String resumeToken,
        int resumeCount,
        String caseRunId,
        String planStartTime,
        Integer suitePosition,
        String suiteRunId,
        String suiteStartTime,
        Integer iteration,
        Integer nodePosition,
        Integer attempt,
        JsonNode runRequest,
        String reason,
        int delaySec,
        String createdAt
) {
    public enum State {
        PENDING_RESUME,
        RESUMING,
        FINALIZED,
        ABORTED
    }

    public ResumeSession withState(State newState, int newResumeCount) {
        return new ResumeSession(runId, runType, target, newState, nextPhase, resumeToken, newResumeCount, caseRunId,
                planStartTime, suitePosition, suiteRunId, suiteStartTime, iteration, nodePosition, attempt,
                runRequest, reason, delaySec, createdAt);
    }

    public ResumeSession withToken(String token) {
        return new ResumeSession(runId, runType, target, state, nextPhase, token, resumeCount, caseRunId,
                planStartTime, suitePosition, suiteRunId, suiteStartTime, iteration, nodePosition, attempt,
                runRequest, reason, delaySec, createdAt);
    }
}
