package io.validrun.reboot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Leaves the reboot to an operator or outer automation and logs how to resume.
 */
public final class NoopRebootHandler implements RebootHandler {
    private static final Logger log = LoggerFactory.getLogger(NoopRebootHandler.class);

    @Override
    public void requestReboot(RebootRequest request, ResumeSession session) {
        log.info("Reboot requested for run {} ({}); resume with: resume --runId {} --token {}",
                session.runId(), request.reason(), session.runId(), session.resumeToken());
    }
}
