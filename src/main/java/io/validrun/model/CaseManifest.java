package io.validrun.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Optional;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CaseManifest(
        String schemaVersion,
        String id,
        String name,
        String category,
        String description,
        String version,
        Privilege privilege,
        Integer timeoutSec,
        List<String> tags,
        List<ParameterDefinition> parameters
) {
    public CaseManifest {
        privilege = privilege == null ? Privilege.USER : privilege;
        tags = tags == null ? List.of() : List.copyOf(tags);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public Identity identity() {
        return new Identity(id, version);
    }

    public Optional<ParameterDefinition> parameter(String name) {
        return parameters.stream().filter(p -> p.name().equals(name)).findFirst();
    }
}
