package io.validrun.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import io.validrun.model.CaseManifest;
import io.validrun.model.ErrorCodes;
import io.validrun.model.ValidationException;
import io.validrun.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

final class InputResolverTest {

    private static final CaseManifest MANIFEST = manifest("""
            {
              "id": "net.ping", "version": "1.0.0",
              "parameters": [
                {"name": "Target", "type": "string", "required": true},
                {"name": "Count", "type": "int", "default": 1, "min": 1, "max": 100},
                {"name": "Mode", "type": "enum", "enumValues": ["Fast", "Full"], "default": "Fast"},
                {"name": "Password", "type": "string"},
                {"name": "Verbose", "type": "bool", "default": false}
              ]
            }
            """);

    @Test
    void laterLayersWin() {
        ResolvedInputs inputs = InputResolver.resolve(MANIFEST,
                inputs("{\"Target\": \"node\", \"Count\": 2}"),
                inputs("{\"Count\": 3}"),
                Map.of());

        ResolvedInput count = inputs.get("Count").orElseThrow();
        Assertions.assertEquals(ParameterValue.integer(3), count.value());
        Assertions.assertEquals(ResolvedInput.Source.OVERRIDE, count.source());
        Assertions.assertEquals(ResolvedInput.Source.NODE, inputs.get("Target").orElseThrow().source());
        Assertions.assertEquals(ResolvedInput.Source.DEFAULT, inputs.get("Mode").orElseThrow().source());
        Assertions.assertEquals(ParameterValue.bool(false), inputs.get("Verbose").orElseThrow().value());
    }

    @Test
    void envRefReadsEnvironmentAndFallsBackToDefault() {
        Map<String, String> env = Map.of("PING_TARGET", "10.0.0.1", "PING_COUNT", "");
        ResolvedInputs inputs = InputResolver.resolve(MANIFEST,
                inputs("""
                        {
                          "Target": {"$env": "PING_TARGET"},
                          "Count": {"$env": "PING_COUNT", "default": 9}
                        }
                        """),
                Map.of(), env);

        Assertions.assertEquals("10.0.0.1", inputs.get("Target").orElseThrow().value().asText());
        Assertions.assertEquals(ParameterValue.integer(9), inputs.get("Count").orElseThrow().value());
    }

    @Test
    void optionalEnvRefWithoutValueOmitsParameter() {
        ResolvedInputs inputs = InputResolver.resolve(MANIFEST,
                inputs("{\"Target\": \"t\", \"Password\": {\"$env\": \"NOT_SET\"}}"), Map.of(), Map.of());
        Assertions.assertTrue(inputs.get("Password").isEmpty());
    }

    @Test
    void secretEnvRefIsMarkedAndRedacted() {
        ResolvedInputs inputs = InputResolver.resolve(MANIFEST,
                inputs("{\"Target\": \"t\", \"Password\": {\"$env\": \"LAB_PASSWORD\", \"secret\": true}}"),
                Map.of(), Map.of("LAB_PASSWORD", "hunter2"));

        Assertions.assertTrue(inputs.get("Password").orElseThrow().secret());
        Assertions.assertEquals(java.util.Set.of("Password"), inputs.secretNames());
        Assertions.assertEquals(java.util.List.of("hunter2"), inputs.secretValues());
        Assertions.assertEquals(ResolvedInputs.REDACTED, inputs.redactedJson().get("Password").asText());
        Assertions.assertTrue(inputs.warnings().stream().anyMatch(w -> w.startsWith(ErrorCodes.ENV_REF_SECRET_ON_COMMAND_LINE)));
    }

    @Test
    void collectsAllErrorsAtOnce() {
        ValidationException e = Assertions.assertThrows(ValidationException.class, () -> InputResolver.resolve(MANIFEST,
                inputs("{\"Bogus\": 1, \"Count\": 500, \"Mode\": \"Slow\"}"),
                inputs("{\"Password\": {\"$env\": \"MISSING\", \"required\": true}}"),
                Map.of()));

        Assertions.assertTrue(e.hasCode(ErrorCodes.PARAMETER_UNKNOWN));
        Assertions.assertTrue(e.hasCode(ErrorCodes.PARAMETER_RANGE_INVALID));
        Assertions.assertTrue(e.hasCode(ErrorCodes.PARAMETER_ENUM_INVALID));
        Assertions.assertTrue(e.hasCode(ErrorCodes.ENV_REF_RESOLVE_FAILED));
        Assertions.assertTrue(e.hasCode(ErrorCodes.PARAMETER_REQUIRED));
        Assertions.assertEquals(5, e.errors().size());
    }

    @Test
    void requiredParameterWithoutValueFails() {
        ValidationException e = Assertions.assertThrows(ValidationException.class,
                () -> InputResolver.resolve(MANIFEST, Map.of(), Map.of(), Map.of()));
        Assertions.assertTrue(e.hasCode(ErrorCodes.PARAMETER_REQUIRED));
        Assertions.assertEquals("Target", e.errors().get(0).details().get("parameter"));
    }

    private static CaseManifest manifest(String json) {
        try {
            return Jsons.mapper().treeToValue(Jsons.parse(json), CaseManifest.class);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static Map<String, JsonNode> inputs(String json) {
        Map<String, JsonNode> out = new LinkedHashMap<>();
        Jsons.parse(json).fields().forEachRemaining(entry -> out.put(entry.getKey(), entry.getValue()));
        return out;
    }
}
