package io.validrun.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Input value that points at an environment variable instead of carrying a literal.
 * JSON shape: {@code {"$env": "NAME", "default": ..., "required": false, "secret": false}}.
 */
public record EnvRef(String name, JsonNode defaultValue, boolean required, boolean secret) {
    public static final String KEY = "$env";

    public static boolean isEnvRef(JsonNode node) {
        return node != null && node.isObject() && node.has(KEY);
    }

    public static Optional<EnvRef> tryParse(JsonNode node) {
        if (!isEnvRef(node)) {
            return Optional.empty();
        }
        JsonNode name = node.get(KEY);
        if (name == null || !name.isTextual() || name.asText().isBlank()) {
            throw new IllegalArgumentException("$env must be a non-empty string");
        }
        JsonNode defaultValue = node.get("default");
        return Optional.of(new EnvRef(
                name.asText().trim(),
                defaultValue == null || defaultValue.isNull() ? null : defaultValue,
                node.path("required").asBoolean(false),
                node.path("secret").asBoolean(false)
        ));
    }
}
