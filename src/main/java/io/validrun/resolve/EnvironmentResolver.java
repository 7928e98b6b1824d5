package io.validrun.resolve;

import io.validrun.model.ErrorCodes;
import io.validrun.model.ValidationError;
import io.validrun.model.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layers environment maps: OS &lt; plan &lt; suite &lt; run request.
 */
public final class EnvironmentResolver {
    private EnvironmentResolver() {
    }

    public static Map<String, String> effective(
            Map<String, String> osEnvironment,
            Map<String, String> planEnv,
            Map<String, String> suiteEnv,
            Map<String, String> requestEnv
    ) {
        List<ValidationError> errors = new ArrayList<>();
        Map<String, String> result = new LinkedHashMap<>(osEnvironment == null ? Map.of() : osEnvironment);
        overlay(result, planEnv, "plan", errors);
        overlay(result, suiteEnv, "suite", errors);
        overlay(result, requestEnv, "runRequest", errors);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return result;
    }

    /**
     * Only the keys layered on top of the OS environment, used for snapshots.
     */
    public static Map<String, String> overridesOnly(
            Map<String, String> planEnv,
            Map<String, String> suiteEnv,
            Map<String, String> requestEnv
    ) {
        return effective(Map.of(), planEnv, suiteEnv, requestEnv);
    }

    private static void overlay(Map<String, String> target, Map<String, String> layer, String source, List<ValidationError> errors) {
        if (layer == null) {
            return;
        }
        for (Map.Entry<String, String> entry : layer.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                errors.add(ValidationError.of(ErrorCodes.ENVIRONMENT_KEY_EMPTY,
                        "Environment key cannot be empty (" + source + ")", "source", source));
                continue;
            }
            target.put(entry.getKey(), entry.getValue() == null ? "" : entry.getValue());
        }
    }
}
