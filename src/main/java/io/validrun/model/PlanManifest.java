package io.validrun.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import io.validrun.util.Jsons;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlanManifest(
        String schemaVersion,
        String id,
        String name,
        String description,
        String version,
        List<String> tags,
        SuiteControls controls,
        Environment environment,
        List<Node> suites
) {
    public PlanManifest {
        tags = tags == null ? List.of() : List.copyOf(tags);
        controls = controls == null ? SuiteControls.empty() : controls;
        environment = environment == null ? new Environment(Map.of()) : environment;
        suites = suites == null ? List.of() : List.copyOf(suites);
    }

    public Identity identity() {
        return new Identity(id, version);
    }

    public record Environment(Map<String, String> env) {
        public Environment {
            env = env == null ? Map.of() : new LinkedHashMap<>(env);
        }
    }

    /**
     * A suites entry: either a bare {@code id@version} string or {@code {nodeId, ref, controls}}.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Node(String nodeId, String ref, SuiteControls controls) {
        @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
        public static Node fromJson(JsonNode raw) {
            if (raw == null || raw.isNull()) {
                throw new IllegalArgumentException("plan suite entry cannot be null");
            }
            if (raw.isTextual()) {
                return new Node(null, raw.asText(), null);
            }
            if (!raw.isObject()) {
                throw new IllegalArgumentException("plan suite entry must be a string or object");
            }
            SuiteControls controls = raw.hasNonNull("controls")
                    ? Jsons.mapper().convertValue(raw.get("controls"), SuiteControls.class)
                    : null;
            String nodeId = raw.hasNonNull("nodeId") ? raw.get("nodeId").asText() : null;
            return new Node(nodeId, raw.path("ref").asText(""), controls);
        }

        public String effectiveNodeId() {
            return nodeId == null || nodeId.isBlank() ? ref : nodeId;
        }
    }
}
