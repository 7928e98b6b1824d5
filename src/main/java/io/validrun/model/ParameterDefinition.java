package io.validrun.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParameterDefinition(
        String name,
        ParameterType type,
        boolean required,
        @JsonProperty("default") JsonNode defaultValue,
        Double min,
        Double max,
        List<String> enumValues,
        String unit,
        String uiHint,
        String pattern,
        String help
) {
    public ParameterDefinition {
        enumValues = enumValues == null ? null : List.copyOf(enumValues);
    }

    public boolean hasDefault() {
        return defaultValue != null && !defaultValue.isNull() && !defaultValue.isMissingNode();
    }
}
