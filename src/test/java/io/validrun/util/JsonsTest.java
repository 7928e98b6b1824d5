package io.validrun.util;

import com.fasterxml.jackson.databind.JsonNode;
import io.validrun.Fixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

final class JsonsTest {

    @Test
    void writeAtomicallyReplacesExistingFileWithoutLeavingTemp() throws Exception {
        Path root = Files.createTempDirectory("validrun-jsons-");
        try {
            Path target = root.resolve("nested").resolve("result.json");
            Jsons.writeAtomically(target, Map.of("status", "RebootRequired"));
            Jsons.writeAtomically(target, Map.of("status", "Passed"));

            JsonNode written = Jsons.readTree(target);
            Assertions.assertEquals("Passed", written.path("status").asText());
            Assertions.assertFalse(Files.exists(target.resolveSibling("result.json.tmp")));
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void compactJsonIsSingleLine() {
        String line = Jsons.toCompactJson(Map.of("a", 1, "b", "two"));
        Assertions.assertFalse(line.contains("\n"));
        Assertions.assertTrue(line.contains("\"b\":\"two\""));
    }

    @Test
    void parseRejectsMalformedJson() {
        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class, () -> Jsons.parse("{oops"));
        Assertions.assertTrue(e.getMessage().startsWith("Invalid JSON"));
    }
}
