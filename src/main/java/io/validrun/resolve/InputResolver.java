package io.validrun.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import io.validrun.model.CaseManifest;
import io.validrun.model.EnvRef;
import io.validrun.model.ErrorCodes;
import io.validrun.model.ParameterDefinition;
import io.validrun.model.ValidationError;
import io.validrun.model.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the effective inputs of one case invocation.
 *
 * <p>Layers, lowest first: manifest defaults, node inputs from the suite, run-request overrides.
 * Every error found is collected and thrown together so nothing starts on a partial input set.
 */
public final class InputResolver {
    private static final Logger log = LoggerFactory.getLogger(InputResolver.class);

    private InputResolver() {
    }

    public static ResolvedInputs resolve(
            CaseManifest manifest,
            Map<String, JsonNode> nodeInputs,
            Map<String, JsonNode> overrideInputs,
            Map<String, String> environment
    ) {
        List<ValidationError> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<String, Layered> merged = new LinkedHashMap<>();
        for (ParameterDefinition definition : manifest.parameters()) {
            if (definition.hasDefault()) {
                merged.put(definition.name(), new Layered(definition.defaultValue(), ResolvedInput.Source.DEFAULT));
            }
        }
        applyLayer(manifest, nodeInputs, ResolvedInput.Source.NODE, merged, errors);
        applyLayer(manifest, overrideInputs, ResolvedInput.Source.OVERRIDE, merged, errors);

        List<ResolvedInput> resolved = new ArrayList<>();
        for (ParameterDefinition definition : manifest.parameters()) {
            Layered raw = merged.get(definition.name());
            if (raw == null || raw.value() == null || raw.value().isNull()) {
                continue;
            }
            ResolvedInput input = resolveOne(definition, raw, environment, errors, warnings);
            if (input != null) {
                resolved.add(input);
            }
        }

        for (ParameterDefinition definition : manifest.parameters()) {
            boolean present = resolved.stream().anyMatch(r -> r.name().equals(definition.name()));
            boolean alreadyFailed = errors.stream().anyMatch(e -> definition.name().equals(e.details().get("parameter")));
            if (definition.required() && !present && !alreadyFailed) {
                errors.add(ValidationError.of(
                        ErrorCodes.PARAMETER_REQUIRED,
                        "Required parameter '" + definition.name() + "' has no value",
                        "parameter", definition.name(),
                        "testCase", manifest.identity().toString()
                ));
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        for (String warning : warnings) {
            log.warn(warning);
        }
        return new ResolvedInputs(resolved, warnings);
    }

    private static void applyLayer(
            CaseManifest manifest,
            Map<String, JsonNode> layer,
            ResolvedInput.Source source,
            Map<String, Layered> merged,
            List<ValidationError> errors
    ) {
        if (layer == null) {
            return;
        }
        for (Map.Entry<String, JsonNode> entry : layer.entrySet()) {
            if (manifest.parameter(entry.getKey()).isEmpty()) {
                errors.add(ValidationError.of(
                        ErrorCodes.PARAMETER_UNKNOWN,
                        "Parameter '" + entry.getKey() + "' is not declared by " + manifest.identity(),
                        "parameter", entry.getKey(),
                        "testCase", manifest.identity().toString()
                ));
                continue;
            }
            merged.put(entry.getKey(), new Layered(entry.getValue(), source));
        }
    }

    private static ResolvedInput resolveOne(
            ParameterDefinition definition,
            Layered raw,
            Map<String, String> environment,
            List<ValidationError> errors,
            List<String> warnings
    ) {
        if (!EnvRef.isEnvRef(raw.value())) {
            return accept(definition, ParameterConverter.fromJson(definition, raw.value()), false, raw.source(), errors);
        }
        EnvRef ref;
        try {
            ref = EnvRef.tryParse(raw.value()).orElseThrow();
        } catch (IllegalArgumentException e) {
            errors.add(envRefError(definition, null, e.getMessage()));
            return null;
        }
        String envValue = environment == null ? null : environment.get(ref.name());
        ParameterConverter.Conversion conversion;
        if (envValue == null || envValue.isEmpty()) {
            if (ref.defaultValue() != null) {
                conversion = ParameterConverter.fromJson(definition, ref.defaultValue());
            } else if (ref.required()) {
                errors.add(envRefError(definition, ref.name(), "environment variable is not set"));
                return null;
            } else {
                return null;
            }
        } else {
            conversion = ParameterConverter.fromEnvironment(definition, envValue);
        }
        if (ref.secret() && conversion.succeeded()) {
            warnings.add(ErrorCodes.ENV_REF_SECRET_ON_COMMAND_LINE + ": secret parameter '" + definition.name()
                    + "' is passed to the script as a command-line argument");
        }
        return accept(definition, conversion, ref.secret(), raw.source(), errors);
    }

    private static ResolvedInput accept(
            ParameterDefinition definition,
            ParameterConverter.Conversion conversion,
            boolean secret,
            ResolvedInput.Source source,
            List<ValidationError> errors
    ) {
        if (!conversion.succeeded()) {
            errors.add(conversion.error());
            return null;
        }
        return new ResolvedInput(definition.name(), conversion.value(), secret, source);
    }

    private static ValidationError envRefError(ParameterDefinition definition, String envName, String reason) {
        return ValidationError.of(
                ErrorCodes.ENV_REF_RESOLVE_FAILED,
                "Parameter '" + definition.name() + "' could not be resolved from environment: " + reason,
                "parameter", definition.name(),
                "env", envName
        );
    }

    private record Layered(JsonNode value, ResolvedInput.Source source) {
    }
}
