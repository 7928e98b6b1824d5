package io.validrun.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record ValidationError(
        String code,
        String message,
        Map<String, Object> details
) {
    public ValidationError {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static ValidationError of(String code, String message) {
        return new ValidationError(code, message, Map.of());
    }

    public static ValidationError of(String code, String message, Object... keyValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                details.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return new ValidationError(code, message, details);
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
