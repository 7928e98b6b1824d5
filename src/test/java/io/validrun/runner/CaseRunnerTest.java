package io.validrun.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.validrun.Fixtures;
import io.validrun.config.ValidRunConfig;
import io.validrun.discovery.ManifestLoader;
import io.validrun.model.CaseManifest;
import io.validrun.model.ErrorType;
import io.validrun.model.RunStatus;
import io.validrun.resolve.InputResolver;
import io.validrun.resolve.ResolvedInputs;
import io.validrun.storage.CaseResult;
import io.validrun.storage.CaseRunFolder;
import io.validrun.storage.RunIndexWriter;
import io.validrun.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@DisabledOnOs(OS.WINDOWS)
final class CaseRunnerTest {
    private static final String PARAMETERS = """
            [
              {"name": "Target", "type": "string", "required": true},
              {"name": "Password", "type": "string"}
            ]
            """;

    @Test
    void passingScriptGetsArgumentsAndInjectedEnvironment() throws Exception {
        Path root = Files.createTempDirectory("validrun-caserunner-");
        try {
            ValidRunConfig config = Fixtures.shellConfig(root);
            Path caseDir = Fixtures.writeCase(config, "Demo", Fixtures.caseManifest("demo", "1.0.0", PARAMETERS), """
                    echo "args: $*"
                    echo "id=$VALIDRUN_TESTCASE_ID ver=$VALIDRUN_TESTCASE_VER phase=$VALIDRUN_PHASE lab=$LAB"
                    echo "evidence" > "$VALIDRUN_CONTROL_DIR/../artifacts/out.txt"
                    exit 0
                    """);
            try (RunIndexWriter index = RunIndexWriter.open(config.indexFile())) {
                CaseRunFolder folder = CaseRunFolder.create("R-1", config.runsRoot().resolve("R-1"));
                CaseRunOutcome outcome = new CaseRunner(config, index, new CancellationToken(), false)
                        .run(invocation(caseDir, folder, Map.of("Target", TextNode.valueOf("lab-01")), Map.of()));

                Assertions.assertFalse(outcome.suspended());
                CaseResult result = folder.readResult();
                Assertions.assertEquals(RunStatus.PASSED, result.status());
                Assertions.assertEquals(Integer.valueOf(0), result.exitCode());
                Assertions.assertEquals("demo", result.testId());
                String stdout = Files.readString(folder.stdoutLog(), StandardCharsets.UTF_8);
                Assertions.assertTrue(stdout.contains("args: -Target lab-01"), stdout);
                Assertions.assertTrue(stdout.contains("id=demo ver=1.0.0 phase=0 lab=east"), stdout);
                Assertions.assertTrue(Files.exists(folder.artifactsDir().resolve("out.txt")));
                Assertions.assertTrue(Files.exists(folder.manifestFile()));
                Assertions.assertEquals("lab-01", folder.readParams().path("Target").asText());
                Assertions.assertEquals(1, Fixtures.readLines(config.indexFile()).size());
            }
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void secretInputIsRedactedEverywhereButPassedToScript() throws Exception {
        Path root = Files.createTempDirectory("validrun-caserunner-secret-");
        try {
            ValidRunConfig config = Fixtures.shellConfig(root);
            Path caseDir = Fixtures.writeCase(config, "Demo", Fixtures.caseManifest("demo", "1", PARAMETERS), """
                    echo "password arg: $4"
                    exit 0
                    """);
            Map<String, JsonNode> inputs = Map.of(
                    "Target", TextNode.valueOf("t"),
                    "Password", Jsons.parse("{\"$env\": \"LAB_PASSWORD\", \"secret\": true}"));
            try (RunIndexWriter index = RunIndexWriter.open(config.indexFile())) {
                CaseRunFolder folder = CaseRunFolder.create("R-2", config.runsRoot().resolve("R-2"));
                new CaseRunner(config, index, new CancellationToken(), false)
                        .run(invocation(caseDir, folder, inputs, Map.of("LAB_PASSWORD", "pa55word")));

                Assertions.assertEquals(RunStatus.PASSED, folder.readResult().status());
                Assertions.assertEquals("***", folder.readParams().path("Password").asText());
                Assertions.assertTrue(Files.readString(folder.stdoutLog(), StandardCharsets.UTF_8).contains("password arg: ***"));
                Assertions.assertFalse(Files.readString(folder.envFile(), StandardCharsets.UTF_8).contains("pa55word"));
                Assertions.assertFalse(Files.readString(folder.resultFile(), StandardCharsets.UTF_8).contains("pa55word"));
            }
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void validRebootRequestSuspendsAndInvalidOneIsError() throws Exception {
        Path root = Files.createTempDirectory("validrun-caserunner-reboot-");
        try {
            ValidRunConfig config = Fixtures.shellConfig(root);
            Path good = Fixtures.writeCase(config, "Good", Fixtures.caseManifest("good", "1", null), """
                    printf '{"type":"control.reboot_required","nextPhase":2,"reason":"driver","reboot":{"delaySec":5}}' > "$VALIDRUN_CONTROL_DIR/reboot.json"
                    exit 0
                    """);
            Path bad = Fixtures.writeCase(config, "Bad", Fixtures.caseManifest("bad", "1", null), """
                    printf '{"type":"control.reboot_required","nextPhase":0,"reason":"x"}' > "$VALIDRUN_CONTROL_DIR/reboot.json"
                    exit 0
                    """);
            try (RunIndexWriter index = RunIndexWriter.open(config.indexFile())) {
                CaseRunner runner = new CaseRunner(config, index, new CancellationToken(), false);

                CaseRunFolder goodFolder = CaseRunFolder.create("R-good", config.runsRoot().resolve("R-good"));
                CaseRunOutcome suspended = runner.run(invocation(good, goodFolder, Map.of(), Map.of()));
                Assertions.assertTrue(suspended.suspended());
                Assertions.assertEquals(2, suspended.rebootRequest().nextPhase());
                Assertions.assertEquals(5, suspended.rebootRequest().delaySec());
                Assertions.assertEquals(RunStatus.REBOOT_REQUIRED, goodFolder.readResult().status());

                CaseRunFolder badFolder = CaseRunFolder.create("R-bad", config.runsRoot().resolve("R-bad"));
                CaseRunOutcome invalid = runner.run(invocation(bad, badFolder, Map.of(), Map.of()));
                Assertions.assertFalse(invalid.suspended());
                Assertions.assertEquals(RunStatus.ERROR, invalid.result().status());
                Assertions.assertEquals(ErrorType.SCRIPT_ERROR, invalid.result().error().type());
            }
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void missingScriptIsRunnerError() throws Exception {
        Path root = Files.createTempDirectory("validrun-caserunner-noscript-");
        try {
            ValidRunConfig config = Fixtures.shellConfig(root);
            Path caseDir = Fixtures.writeCase(config, "NoScript", Fixtures.caseManifest("noscript", "1", null), null);
            try (RunIndexWriter index = RunIndexWriter.open(config.indexFile())) {
                CaseRunFolder folder = CaseRunFolder.create("R-3", config.runsRoot().resolve("R-3"));
                CaseRunOutcome outcome = new CaseRunner(config, index, new CancellationToken(), false)
                        .run(invocation(caseDir, folder, Map.of(), Map.of()));

                Assertions.assertEquals(RunStatus.ERROR, outcome.result().status());
                Assertions.assertEquals(ErrorType.RUNNER_ERROR, outcome.result().error().type());
            }
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void manifestTimeoutProducesTimeout() throws Exception {
        Path root = Files.createTempDirectory("validrun-caserunner-timeout-");
        try {
            ValidRunConfig config = Fixtures.shellConfig(root);
            Path caseDir = Fixtures.writeCase(config, "Slow",
                    "{\"id\": \"slow\", \"version\": \"1\", \"timeoutSec\": 1}", """
                    echo "PASSED"
                    sleep 30
                    exit 0
                    """);
            try (RunIndexWriter index = RunIndexWriter.open(config.indexFile())) {
                CaseRunFolder folder = CaseRunFolder.create("R-4", config.runsRoot().resolve("R-4"));
                CaseRunOutcome outcome = new CaseRunner(config, index, new CancellationToken(), false)
                        .run(invocation(caseDir, folder, Map.of(), Map.of()));

                Assertions.assertEquals(RunStatus.TIMEOUT, outcome.result().status());
                Assertions.assertEquals(ErrorType.TIMEOUT, outcome.result().error().type());
            }
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    private static CaseInvocation invocation(Path caseDir, CaseRunFolder folder, Map<String, JsonNode> inputs,
                                             Map<String, String> env) throws Exception {
        Path manifestPath = caseDir.resolve(ManifestLoader.CASE_MANIFEST);
        CaseManifest manifest = ManifestLoader.loadCase(manifestPath);
        ResolvedInputs resolved = InputResolver.resolve(manifest, Map.of(), inputs, env);
        Map<String, String> overlay = env.isEmpty() ? Map.of("LAB", "east") : env;
        return new CaseInvocation(folder, manifest, caseDir, manifestPath, null, null, resolved, overlay, 0,
                null, null, null, null);
    }
}
