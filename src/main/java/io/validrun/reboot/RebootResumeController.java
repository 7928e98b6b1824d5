package io.validrun.reboot;

import io.validrun.model.ErrorCodes;
import io.validrun.model.ValidationError;
import io.validrun.model.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Suspends runs into a durable session and admits each suspension to exactly one resume.
 */
public final class RebootResumeController {
    private static final Logger log = LoggerFactory.getLogger(RebootResumeController.class);
    private static final int MAX_RESUMES = 1;

    private final RebootHandler handler;
    private final SecureRandom random = new SecureRandom();

    public RebootResumeController(RebootHandler handler) {
        this.handler = handler;
    }

    /**
     * Persists the session as {@code PendingResume} with a fresh token, then hands off to the handler.
     */
    public ResumeSession suspend(Path runFolder, ResumeSession draft, RebootRequest request) {
        ResumeSession session = draft.withToken(newToken()).withState(ResumeSession.State.PENDING_RESUME, 0);
        ResumeSessionStore.save(runFolder, session);
        log.info("Run {} suspended for reboot, next phase {}", session.runId(), session.nextPhase());
        handler.requestReboot(request, session);
        return session;
    }

    /**
     * Validates the token and moves the session to {@code Resuming} before anything re-runs.
     */
    public Admission beginResume(Path runFolder, String token) {
        ResumeSession session = ResumeSessionStore.load(runFolder).orElseThrow(() -> new ValidationException(
                ValidationError.of(ErrorCodes.RESUME_SESSION_INVALID, "No resume session in " + runFolder)));
        if (token == null || !token.equals(session.resumeToken())) {
            throw new ValidationException(ValidationError.of(
                    ErrorCodes.RESUME_TOKEN_MISMATCH, "Resume token does not match run " + session.runId()));
        }
        if (session.state() == ResumeSession.State.FINALIZED || session.state() == ResumeSession.State.ABORTED) {
            throw new ValidationException(ValidationError.of(
                    ErrorCodes.RESUME_SESSION_INVALID,
                    "Run " + session.runId() + " is already " + session.state(),
                    "state", session.state().name()));
        }
        int count = session.resumeCount() + 1;
        if (count > MAX_RESUMES || session.state() != ResumeSession.State.PENDING_RESUME) {
            ResumeSession aborted = session.withState(ResumeSession.State.ABORTED, count);
            ResumeSessionStore.save(runFolder, aborted);
            log.error("Resume loop detected for run {} (resume #{})", session.runId(), count);
            return new Admission(aborted, false, "Resume loop detected");
        }
        ResumeSession resuming = session.withState(ResumeSession.State.RESUMING, count);
        ResumeSessionStore.save(runFolder, resuming);
        return new Admission(resuming, true, null);
    }

    public void finalizeSession(Path runFolder, ResumeSession session) {
        ResumeSessionStore.save(runFolder, session.withState(ResumeSession.State.FINALIZED, session.resumeCount()));
    }

    /**
     * Closes an admitted session that could not continue. No further resume is accepted.
     */
    public void abort(Path runFolder, ResumeSession session) {
        ResumeSessionStore.save(runFolder, session.withState(ResumeSession.State.ABORTED, session.resumeCount()));
    }

    private String newToken() {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    public record Admission(ResumeSession session, boolean admitted, String reason) {
    }
}
