package io.validrun.reboot;

/**
 * Parsed {@code control/reboot.json}.
 */
public record RebootRequest(int nextPhase, String reason, int delaySec) {
    public static final String TYPE = "control.reboot_required";
    public static final String FILE_NAME = "reboot.json";
}
