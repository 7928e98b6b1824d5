package io.validrun.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record RunRequest(
        String suite,
        String testCase,
        String plan,
        Map<String, NodeOverride> nodeOverrides,
        Map<String, JsonNode> caseInputs,
        EnvironmentOverrides environmentOverrides
) {
    public RunRequest {
        nodeOverrides = nodeOverrides == null ? Map.of() : new LinkedHashMap<>(nodeOverrides);
        caseInputs = caseInputs == null ? Map.of() : new LinkedHashMap<>(caseInputs);
        environmentOverrides = environmentOverrides == null ? new EnvironmentOverrides(Map.of()) : environmentOverrides;
    }

    public static RunRequest forCase(String identity, Map<String, JsonNode> inputs, Map<String, String> env) {
        return new RunRequest(null, identity, null, null, inputs, new EnvironmentOverrides(env));
    }

    public static RunRequest forSuite(String identity, Map<String, NodeOverride> overrides, Map<String, String> env) {
        return new RunRequest(identity, null, null, overrides, null, new EnvironmentOverrides(env));
    }

    public static RunRequest forPlan(String identity, Map<String, String> env) {
        return new RunRequest(null, null, identity, null, null, new EnvironmentOverrides(env));
    }

    public RunType runType() {
        if (plan != null) {
            return RunType.TEST_PLAN;
        }
        if (suite != null) {
            return RunType.TEST_SUITE;
        }
        return RunType.TEST_CASE;
    }

    public Identity targetIdentity() {
        return Identity.parse(switch (runType()) {
            case TEST_PLAN -> plan;
            case TEST_SUITE -> suite;
            case TEST_CASE -> testCase;
        });
    }

    /**
     * Structural checks that do not need discovery.
     */
    public void validateShape() {
        List<ValidationError> errors = new ArrayList<>();
        int targets = (suite != null ? 1 : 0) + (testCase != null ? 1 : 0) + (plan != null ? 1 : 0);
        if (targets != 1) {
            errors.add(ValidationError.of(ErrorCodes.RUN_REQUEST_INVALID,
                    "RunRequest must name exactly one of suite, testCase or plan"));
        }
        if (plan != null && (!nodeOverrides.isEmpty() || !caseInputs.isEmpty())) {
            errors.add(ValidationError.of(ErrorCodes.RUN_REQUEST_PLAN_INPUT_OVERRIDE,
                    "Plan RunRequest cannot carry nodeOverrides or caseInputs", "plan", plan));
        }
        if (testCase != null && !nodeOverrides.isEmpty()) {
            errors.add(ValidationError.of(ErrorCodes.RUN_REQUEST_INVALID,
                    "Standalone testCase RunRequest cannot carry nodeOverrides", "testCase", testCase));
        }
        if (suite != null && !caseInputs.isEmpty()) {
            errors.add(ValidationError.of(ErrorCodes.RUN_REQUEST_INVALID,
                    "Suite RunRequest must use nodeOverrides instead of caseInputs", "suite", suite));
        }
        for (String key : environmentOverrides.env().keySet()) {
            if (key == null || key.isBlank()) {
                errors.add(ValidationError.of(ErrorCodes.ENVIRONMENT_KEY_EMPTY,
                        "environmentOverrides.env contains an empty key"));
            }
        }
        if (targets == 1) {
            String raw = plan != null ? plan : suite != null ? suite : testCase;
            if (Identity.tryParse(raw).isEmpty()) {
                errors.add(ValidationError.of(ErrorCodes.RUN_REQUEST_IDENTITY_INVALID_FORMAT,
                        "Identity must be id@version: " + raw, "identity", raw));
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    public record NodeOverride(Map<String, JsonNode> inputs) {
        public NodeOverride {
            inputs = inputs == null ? Map.of() : new LinkedHashMap<>(inputs);
        }
    }

    public record EnvironmentOverrides(Map<String, String> env) {
        public EnvironmentOverrides {
            env = env == null ? Map.of() : new LinkedHashMap<>(env);
        }
    }
}
