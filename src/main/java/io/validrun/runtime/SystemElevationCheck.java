package io.validrun.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Windows: {@code net session} only succeeds for administrators. Elsewhere: {@code id -u} is 0.
 */
public final class SystemElevationCheck implements ElevationCheck {
    private static final Logger log = LoggerFactory.getLogger(SystemElevationCheck.class);
    private static final long CHECK_TIMEOUT_MS = 5_000L;

    private Boolean cached;

    @Override
    public synchronized boolean isElevated() {
        if (cached == null) {
            cached = detect();
        }
        return cached;
    }

    private static boolean detect() {
        boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
        List<String> command = windows ? List.of("net", "session") : List.of("id", "-u");
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        try {
            Process process = pb.start();
            process.getOutputStream().close();
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
            if (!process.waitFor(CHECK_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("Elevation check {} timed out, assuming not elevated", command);
                return false;
            }
            return windows ? process.exitValue() == 0 : "0".equals(output);
        } catch (IOException e) {
            log.warn("Elevation check {} failed, assuming not elevated: {}", command, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
