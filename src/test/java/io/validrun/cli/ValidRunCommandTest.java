package io.validrun.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.validrun.Fixtures;
import io.validrun.config.ValidRunConfig;
import io.validrun.model.ErrorCodes;
import io.validrun.model.RunRequest;
import io.validrun.model.RunStatus;
import io.validrun.model.RunType;
import io.validrun.model.ValidationException;
import io.validrun.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class ValidRunCommandTest {

    @Test
    void exitCodesFollowStatus() {
        Assertions.assertEquals(0, ValidRunCommand.exitCode(RunStatus.PASSED));
        Assertions.assertEquals(0, ValidRunCommand.exitCode(RunStatus.REBOOT_REQUIRED));
        Assertions.assertEquals(1, ValidRunCommand.exitCode(RunStatus.FAILED));
        Assertions.assertEquals(2, ValidRunCommand.exitCode(RunStatus.ERROR));
        Assertions.assertEquals(2, ValidRunCommand.exitCode(RunStatus.TIMEOUT));
        Assertions.assertEquals(2, ValidRunCommand.exitCode(RunStatus.ABORTED));
    }

    @Test
    void buildsRequestPerTarget() {
        ValidRunCommand.RunCommand command = new ValidRunCommand.RunCommand();
        command.target = "testcase";
        command.id = "cpu@1";
        command.inputs = "{\"Seconds\": 5}";
        command.env = "{\"LAB\": \"east\"}";
        RunRequest single = command.buildRequest();
        Assertions.assertEquals(RunType.TEST_CASE, single.runType());
        Assertions.assertEquals(5, single.caseInputs().get("Seconds").asInt());
        Assertions.assertEquals("east", single.environmentOverrides().env().get("LAB"));

        command.target = "suite";
        command.inputs = "{\"node-1\": {\"inputs\": {\"Seconds\": 9}}}";
        RunRequest suite = command.buildRequest();
        Assertions.assertEquals(RunType.TEST_SUITE, suite.runType());
        Assertions.assertEquals(9, suite.nodeOverrides().get("node-1").inputs().get("Seconds").asInt());

        command.target = "plan";
        ValidationException e = Assertions.assertThrows(ValidationException.class, command::buildRequest);
        Assertions.assertTrue(e.hasCode(ErrorCodes.RUN_REQUEST_PLAN_INPUT_OVERRIDE));

        command.inputs = null;
        Assertions.assertEquals(RunType.TEST_PLAN, command.buildRequest().runType());
    }

    @Test
    void runRequestFileReplacesFlags() throws Exception {
        Path root = Files.createTempDirectory("validrun-cli-request-");
        try {
            Path file = Fixtures.write(root.resolve("request.json"), """
                    {"suite": "net@1", "nodeOverrides": {"a": {"inputs": {"Target": "x"}}}}
                    """);
            ValidRunCommand.RunCommand command = new ValidRunCommand.RunCommand();
            command.runRequest = file.toString();
            RunRequest request = command.buildRequest();
            Assertions.assertEquals("net@1", request.suite());
            Assertions.assertEquals("x", request.nodeOverrides().get("a").inputs().get("Target").asText());

            command.runRequest = root.resolve("missing.json").toString();
            ValidationException e = Assertions.assertThrows(ValidationException.class, command::buildRequest);
            Assertions.assertTrue(e.hasCode(ErrorCodes.RUN_REQUEST_INVALID));
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void discoverPrintsSortedInventory() throws Exception {
        Path root = Files.createTempDirectory("validrun-cli-discover-");
        try {
            ValidRunConfig config = Fixtures.shellConfig(root);
            Fixtures.writeCase(config, "B", Fixtures.caseManifest("beta", "1", null), null);
            Fixtures.writeCase(config, "A", Fixtures.caseManifest("alpha", "1", null), null);

            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            ValidRunCommand app = new ValidRunCommand();
            app.out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
            int exit = new CommandLine(app).execute("discover",
                    "--casesRoot", config.casesRoot().toString(),
                    "--suitesRoot", config.suitesRoot().toString(),
                    "--plansRoot", config.plansRoot().toString(),
                    "--runsRoot", config.runsRoot().toString());

            Assertions.assertEquals(0, exit);
            JsonNode body = Jsons.parse(buffer.toString(StandardCharsets.UTF_8));
            Assertions.assertEquals(2, body.path("counts").path("testCases").asInt());
            Assertions.assertEquals("alpha@1", body.path("testCases").get(0).path("identity").asText());
            Assertions.assertEquals(0, body.path("errors").size());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void runWithoutTargetPrintsErrors() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ValidRunCommand app = new ValidRunCommand();
        app.out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

        int exit = new CommandLine(app).execute("run", "--id", "x@1");

        Assertions.assertEquals(2, exit);
        JsonNode body = Jsons.parse(buffer.toString(StandardCharsets.UTF_8));
        Assertions.assertEquals(ErrorCodes.RUN_REQUEST_INVALID, body.path("errors").get(0).path("code").asText());
    }
}
