package io.validrun.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SuiteManifest(
        String schemaVersion,
        String id,
        String name,
        String description,
        String version,
        List<String> tags,
        SuiteControls controls,
        Environment environment,
        List<Node> testCases
) {
    public SuiteManifest {
        tags = tags == null ? List.of() : List.copyOf(tags);
        controls = controls == null ? SuiteControls.empty() : controls;
        environment = environment == null ? new Environment(Map.of(), null) : environment;
        testCases = testCases == null ? List.of() : List.copyOf(testCases);
    }

    public Identity identity() {
        return new Identity(id, version);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Environment(Map<String, String> env, String workingDir) {
        public Environment {
            env = env == null ? Map.of() : new LinkedHashMap<>(env);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Node(String nodeId, String ref, Map<String, JsonNode> inputs) {
        public Node {
            inputs = inputs == null ? Map.of() : new LinkedHashMap<>(inputs);
        }
    }
}
