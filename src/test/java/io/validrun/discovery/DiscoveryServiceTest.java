package io.validrun.discovery;

import io.validrun.Fixtures;
import io.validrun.config.ValidRunConfig;
import io.validrun.model.ErrorCodes;
import io.validrun.model.Identity;
import io.validrun.model.ValidationError;
import io.validrun.model.ValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class DiscoveryServiceTest {

    @Test
    void discoversAllThreeKindsByIdentity() throws Exception {
        Path root = Files.createTempDirectory("validrun-discovery-");
        try {
            ValidRunConfig config = Fixtures.shellConfig(root);
            Fixtures.writeCase(config, "Cpu/Stress", Fixtures.caseManifest("cpu.stress", "1.0.0", null), null);
            Fixtures.writeSuite(config, "Smoke", """
                    {"id": "smoke", "version": "1", "testCases": [{"nodeId": "a", "ref": "Cpu/Stress"}]}
                    """);
            Fixtures.writePlan(config, "Nightly", """
                    {"id": "nightly", "version": "1", "suites": ["smoke@1"]}
                    """);

            DiscoveryResult result = new DiscoveryService(config).discover();

            Assertions.assertFalse(result.hasErrors());
            Assertions.assertTrue(result.cases().containsKey(Identity.parse("cpu.stress@1.0.0")));
            Assertions.assertTrue(result.suites().containsKey(Identity.parse("smoke@1")));
            Assertions.assertEquals("smoke@1",
                    result.plans().get(Identity.parse("nightly@1")).manifest().suites().get(0).ref());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void reportsEveryDuplicateWithAllConflictingPaths() throws Exception {
        Path root = Files.createTempDirectory("validrun-discovery-dup-");
        try {
            ValidRunConfig config = Fixtures.shellConfig(root);
            String manifest = Fixtures.caseManifest("dup", "1", null);
            Fixtures.writeCase(config, "A", manifest, null);
            Fixtures.writeCase(config, "B", manifest, null);
            Fixtures.writeCase(config, "C/Deep", manifest, null);
            Fixtures.writeSuite(config, "S1", "{\"id\": \"s\", \"version\": \"1\"}");
            Fixtures.writeSuite(config, "S2", "{\"id\": \"s\", \"version\": \"1\"}");

            DiscoveryResult result = new DiscoveryService(config).discover();

            Assertions.assertEquals(2, result.errors().size());
            ValidationError caseError = result.errors().stream()
                    .filter(e -> "testCase".equals(e.details().get("entityType")))
                    .findFirst()
                    .orElseThrow();
            Assertions.assertEquals(ErrorCodes.DISCOVERY_DUPLICATE_IDENTITY, caseError.code());
            Assertions.assertEquals(3, ((List<?>) caseError.details().get("conflictPaths")).size());
            ValidationException e = Assertions.assertThrows(ValidationException.class, result::throwIfErrors);
            Assertions.assertEquals(2, e.errors().size());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void skipsUnparsableManifestsWithWarning() throws Exception {
        Path root = Files.createTempDirectory("validrun-discovery-bad-");
        try {
            ValidRunConfig config = Fixtures.shellConfig(root);
            Fixtures.writeCase(config, "Broken", "{ not json", null);
            Fixtures.writeCase(config, "NoVersion", "{\"id\": \"x\"}", null);
            Fixtures.writeCase(config, "Good", Fixtures.caseManifest("good", "1", null), null);

            DiscoveryResult result = new DiscoveryService(config).discover();

            Assertions.assertFalse(result.hasErrors());
            Assertions.assertEquals(1, result.cases().size());
            Assertions.assertEquals(2, result.warnings().size());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void missingRootsYieldEmptyResult() throws Exception {
        Path root = Files.createTempDirectory("validrun-discovery-empty-");
        try {
            DiscoveryResult result = new DiscoveryService(Fixtures.shellConfig(root)).discover();
            Assertions.assertTrue(result.cases().isEmpty());
            Assertions.assertTrue(result.suites().isEmpty());
            Assertions.assertTrue(result.plans().isEmpty());
            Assertions.assertFalse(result.hasErrors());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }
}
