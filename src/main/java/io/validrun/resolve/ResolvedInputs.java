package io.validrun.resolve;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Effective inputs of one case invocation in manifest parameter order.
 */
public final class ResolvedInputs {
    public static final String REDACTED = "***";

    private final Map<String, ResolvedInput> inputs;
    private final List<String> warnings;

    public ResolvedInputs(Collection<ResolvedInput> inputs, List<String> warnings) {
        Map<String, ResolvedInput> ordered = new LinkedHashMap<>();
        for (ResolvedInput input : inputs) {
            ordered.put(input.name(), input);
        }
        this.inputs = ordered;
        this.warnings = List.copyOf(warnings);
    }

    public static ResolvedInputs empty() {
        return new ResolvedInputs(List.of(), List.of());
    }

    public Collection<ResolvedInput> all() {
        return inputs.values();
    }

    public Optional<ResolvedInput> get(String name) {
        return Optional.ofNullable(inputs.get(name));
    }

    public List<String> warnings() {
        return warnings;
    }

    public Set<String> secretNames() {
        Set<String> names = new LinkedHashSet<>();
        for (ResolvedInput input : inputs.values()) {
            if (input.secret()) {
                names.add(input.name());
            }
        }
        return names;
    }

    /**
     * Plain text of every secret value, for scrubbing captured output.
     */
    public List<String> secretValues() {
        List<String> values = new ArrayList<>();
        for (ResolvedInput input : inputs.values()) {
            if (!input.secret()) {
                continue;
            }
            if (input.value().kind() == ParameterValue.Kind.LIST) {
                for (ParameterValue item : ((ParameterValue.ListValue) input.value()).items()) {
                    values.add(item.asText());
                }
            } else {
                values.add(input.value().asText());
            }
        }
        return values;
    }

    /**
     * Snapshot for params.json: secret values replaced by {@value #REDACTED}.
     */
    public ObjectNode redactedJson() {
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        for (ResolvedInput input : inputs.values()) {
            if (input.secret()) {
                out.put(input.name(), REDACTED);
            } else {
                out.set(input.name(), input.value().toJson());
            }
        }
        return out;
    }
}
