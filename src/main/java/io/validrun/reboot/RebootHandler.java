package io.validrun.reboot;

/**
 * Whatever actually restarts the machine. Called after the session is durable.
 */
public interface RebootHandler {
    void requestReboot(RebootRequest request, ResumeSession session);
}
