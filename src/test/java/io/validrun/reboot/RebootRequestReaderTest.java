package io.validrun.reboot;

import io.validrun.Fixtures;
import io.validrun.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

final class RebootRequestReaderTest {

    @Test
    void parsesValidRequest() {
        RebootRequestReader.ReadResult result = RebootRequestReader.parse(Jsons.parse("""
                {"type": "control.reboot_required", "nextPhase": 2, "reason": "Driver install", "reboot": {"delaySec": 15}}
                """));
        Assertions.assertEquals(RebootRequestReader.ReadResult.Status.VALID, result.status());
        Assertions.assertEquals(new RebootRequest(2, "Driver install", 15), result.request());
    }

    @Test
    void delayDefaultsToZero() {
        RebootRequestReader.ReadResult result = RebootRequestReader.parse(Jsons.parse("""
                {"type": "control.reboot_required", "nextPhase": 1, "reason": "r"}
                """));
        Assertions.assertEquals(0, result.request().delaySec());
    }

    @Test
    void rejectsMalformedRequests() {
        String[] invalid = {
                "[]",
                "{\"type\": \"other\", \"nextPhase\": 1, \"reason\": \"r\"}",
                "{\"type\": \"control.reboot_required\", \"nextPhase\": 0, \"reason\": \"r\"}",
                "{\"type\": \"control.reboot_required\", \"nextPhase\": \"1\", \"reason\": \"r\"}",
                "{\"type\": \"control.reboot_required\", \"nextPhase\": 1, \"reason\": \" \"}",
                "{\"type\": \"control.reboot_required\", \"nextPhase\": 1, \"reason\": \"r\", \"extra\": true}",
                "{\"type\": \"control.reboot_required\", \"nextPhase\": 1, \"reason\": \"r\", \"reboot\": {\"delaySec\": -1}}",
                "{\"type\": \"control.reboot_required\", \"nextPhase\": 1, \"reason\": \"r\", \"reboot\": {\"when\": 1}}"
        };
        for (String raw : invalid) {
            Assertions.assertEquals(RebootRequestReader.ReadResult.Status.INVALID,
                    RebootRequestReader.parse(Jsons.parse(raw)).status(), raw);
        }
    }

    @Test
    void readDistinguishesAbsentUnparsableAndConsumes() throws Exception {
        Path root = Files.createTempDirectory("validrun-reboot-read-");
        try {
            Assertions.assertEquals(RebootRequestReader.ReadResult.Status.NONE, RebootRequestReader.read(root).status());

            Fixtures.write(RebootRequestReader.requestFile(root), "{broken");
            Assertions.assertEquals(RebootRequestReader.ReadResult.Status.INVALID, RebootRequestReader.read(root).status());

            RebootRequestReader.consume(root);
            Assertions.assertFalse(Files.exists(RebootRequestReader.requestFile(root)));
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }
}
