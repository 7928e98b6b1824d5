package io.validrun.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import io.validrun.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;

final class RunRequestTest {

    @Test
    void requiresExactlyOneTarget() {
        RunRequest none = new RunRequest(null, null, null, null, null, null);
        ValidationException e = Assertions.assertThrows(ValidationException.class, none::validateShape);
        Assertions.assertTrue(e.hasCode(ErrorCodes.RUN_REQUEST_INVALID));

        RunRequest two = new RunRequest("s@1", "c@1", null, null, null, null);
        Assertions.assertThrows(ValidationException.class, two::validateShape);
    }

    @Test
    void planRequestCannotCarryInputs() {
        RunRequest request = new RunRequest(null, null, "p@1",
                Map.of("n1", new RunRequest.NodeOverride(Map.of("x", IntNode.valueOf(1)))), null, null);
        ValidationException e = Assertions.assertThrows(ValidationException.class, request::validateShape);
        Assertions.assertTrue(e.hasCode(ErrorCodes.RUN_REQUEST_PLAN_INPUT_OVERRIDE));
    }

    @Test
    void collectsEmptyEnvironmentKeyAndBadIdentityTogether() {
        RunRequest request = RunRequest.forCase("missing-version", Map.of(), Map.of(" ", "v"));
        ValidationException e = Assertions.assertThrows(ValidationException.class, request::validateShape);
        Assertions.assertTrue(e.hasCode(ErrorCodes.ENVIRONMENT_KEY_EMPTY));
        Assertions.assertTrue(e.hasCode(ErrorCodes.RUN_REQUEST_IDENTITY_INVALID_FORMAT));
        Assertions.assertEquals(2, e.errors().size());
    }

    @Test
    void deserializesSuiteRequest() throws Exception {
        JsonNode raw = Jsons.parse("""
                {
                  "suite": "net.suite@1.0.0",
                  "nodeOverrides": {"ping": {"inputs": {"Count": 3}}},
                  "environmentOverrides": {"env": {"LAB": "east"}}
                }
                """);
        RunRequest request = Jsons.mapper().treeToValue(raw, RunRequest.class);
        request.validateShape();
        Assertions.assertEquals(RunType.TEST_SUITE, request.runType());
        Assertions.assertEquals(Identity.parse("net.suite@1.0.0"), request.targetIdentity());
        Assertions.assertEquals(3, request.nodeOverrides().get("ping").inputs().get("Count").asInt());
        Assertions.assertEquals("east", request.environmentOverrides().env().get("LAB"));
    }
}
