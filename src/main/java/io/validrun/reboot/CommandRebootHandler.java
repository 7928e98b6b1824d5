package io.validrun.reboot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a configured command such as {@code shutdown -r -t {delaySec}}. The tokens
 * {@code {delaySec}}, {@code {runId}} and {@code {token}} are substituted.
 */
public final class CommandRebootHandler implements RebootHandler {
    private static final Logger log = LoggerFactory.getLogger(CommandRebootHandler.class);

    private final List<String> command;

    public CommandRebootHandler(List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("reboot command cannot be empty");
        }
        this.command = List.copyOf(command);
    }

    List<String> expand(RebootRequest request, ResumeSession session) {
        List<String> out = new ArrayList<>(command.size());
        for (String token : command) {
            out.add(token
                    .replace("{delaySec}", Integer.toString(request.delaySec()))
                    .replace("{runId}", session.runId())
                    .replace("{token}", session.resumeToken()));
        }
        return out;
    }

    @Override
    public void requestReboot(RebootRequest request, ResumeSession session) {
        List<String> expanded = expand(request, session);
        log.info("Requesting reboot for run {}: {}", session.runId(), expanded);
        try {
            new ProcessBuilder(expanded).inheritIO().start();
        } catch (IOException e) {
            throw new RuntimeException("Failed to start reboot command " + expanded, e);
        }
    }
}
