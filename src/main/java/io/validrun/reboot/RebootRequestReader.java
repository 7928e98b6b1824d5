package io.validrun.reboot;

import com.fasterxml.jackson.databind.JsonNode;
import io.validrun.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Optional;
import java.util.Set;

/**
 * Reads the reboot request a script leaves in its control directory. The format is strict:
 * unknown keys, wrong types or out-of-range values make the request invalid.
 */
public final class RebootRequestReader {
    private static final Set<String> ROOT_KEYS = Set.of("type", "nextPhase", "reason", "reboot");
    private static final Set<String> REBOOT_KEYS = Set.of("delaySec");

    private RebootRequestReader() {
    }

    public static Path requestFile(Path controlDir) {
        return controlDir.resolve(RebootRequest.FILE_NAME);
    }

    public static ReadResult read(Path controlDir) {
        if (controlDir == null) {
            return ReadResult.invalid("reboot requested without a control directory");
        }
        Path file = requestFile(controlDir);
        if (!Files.isRegularFile(file)) {
            return ReadResult.none();
        }
        JsonNode root;
        try {
            root = Jsons.readTree(file);
        } catch (IOException e) {
            return ReadResult.invalid("reboot.json is not valid JSON: " + e.getMessage());
        }
        return parse(root);
    }

    static ReadResult parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            return ReadResult.invalid("reboot.json root must be an object");
        }
        Optional<String> unknown = firstUnknownKey(root, ROOT_KEYS);
        if (unknown.isPresent()) {
            return ReadResult.invalid("Unexpected property '" + unknown.get() + "' in reboot.json");
        }
        JsonNode type = root.get("type");
        if (type == null || !type.isTextual() || !RebootRequest.TYPE.equals(type.asText())) {
            return ReadResult.invalid("reboot.json type must equal '" + RebootRequest.TYPE + "'");
        }
        JsonNode nextPhase = root.get("nextPhase");
        if (nextPhase == null || !nextPhase.isIntegralNumber() || !nextPhase.canConvertToInt() || nextPhase.asInt() < 1) {
            return ReadResult.invalid("reboot.json nextPhase must be an integer >= 1");
        }
        JsonNode reason = root.get("reason");
        if (reason == null || !reason.isTextual() || reason.asText().isBlank()) {
            return ReadResult.invalid("reboot.json reason must be a non-empty string");
        }
        int delaySec = 0;
        JsonNode reboot = root.get("reboot");
        if (reboot != null) {
            if (!reboot.isObject()) {
                return ReadResult.invalid("reboot.json reboot must be an object");
            }
            Optional<String> unknownReboot = firstUnknownKey(reboot, REBOOT_KEYS);
            if (unknownReboot.isPresent()) {
                return ReadResult.invalid("Unexpected property '" + unknownReboot.get() + "' in reboot section");
            }
            JsonNode delay = reboot.get("delaySec");
            if (delay != null) {
                if (!delay.isIntegralNumber() || !delay.canConvertToInt() || delay.asInt() < 0) {
                    return ReadResult.invalid("reboot.json reboot.delaySec must be a non-negative integer");
                }
                delaySec = delay.asInt();
            }
        }
        return ReadResult.valid(new RebootRequest(nextPhase.asInt(), reason.asText(), delaySec));
    }

    /**
     * Deletes a consumed request so a resumed process never sees the previous phase's file.
     */
    public static void consume(Path controlDir) {
        try {
            Files.deleteIfExists(requestFile(controlDir));
        } catch (IOException e) {
            throw new RuntimeException("Failed to remove consumed reboot request in " + controlDir, e);
        }
    }

    private static Optional<String> firstUnknownKey(JsonNode node, Set<String> allowed) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!allowed.contains(name)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    public record ReadResult(Status status, RebootRequest request, String error) {
        public enum Status {
            NONE,
            VALID,
            INVALID
        }

        static ReadResult none() {
            return new ReadResult(Status.NONE, null, null);
        }

        static ReadResult valid(RebootRequest request) {
            return new ReadResult(Status.VALID, request, null);
        }

        static ReadResult invalid(String error) {
            return new ReadResult(Status.INVALID, null, error);
        }
    }
}
