package io.validrun.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import io.validrun.model.ErrorCodes;
import io.validrun.model.ParameterDefinition;
import io.validrun.model.ParameterType;
import io.validrun.model.ValidationError;
import io.validrun.util.Jsons;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Converts literal JSON and environment strings into {@link ParameterValue}s and validates them
 * against their {@link ParameterDefinition}.
 */
public final class ParameterConverter {
    private ParameterConverter() {
    }

    /**
     * Converts a JSON literal. Returns either a value or the error describing why it was rejected.
     */
    public static Conversion fromJson(ParameterDefinition definition, JsonNode literal) {
        try {
            ParameterValue value = convertJson(definition.type(), literal);
            return validate(definition, value);
        } catch (IllegalArgumentException e) {
            return Conversion.failed(typeError(definition, e.getMessage()));
        }
    }

    /**
     * Converts an environment variable string. Array types expect JSON array text.
     */
    public static Conversion fromEnvironment(ParameterDefinition definition, String raw) {
        try {
            ParameterValue value;
            if (definition.type().isArray()) {
                JsonNode parsed = Jsons.parse(raw.trim());
                if (!parsed.isArray()) {
                    throw new IllegalArgumentException("expected a JSON array");
                }
                value = convertJson(definition.type(), parsed);
            } else {
                value = convertText(definition.type(), raw);
            }
            return validate(definition, value);
        } catch (IllegalArgumentException e) {
            return Conversion.failed(typeError(definition, e.getMessage()));
        }
    }

    private static ParameterValue convertJson(ParameterType type, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new IllegalArgumentException("value is null");
        }
        if (type.isArray()) {
            JsonNode array = node;
            if (node.isTextual()) {
                array = Jsons.parse(node.asText().trim());
            }
            if (!array.isArray()) {
                throw new IllegalArgumentException("expected an array");
            }
            List<ParameterValue> items = new ArrayList<>();
            for (JsonNode element : array) {
                items.add(convertJson(type.elementType(), element));
            }
            return ParameterValue.list(items);
        }
        if (node.isContainerNode()) {
            throw new IllegalArgumentException("expected a scalar");
        }
        switch (type) {
            case INT -> {
                if (node.isIntegralNumber()) {
                    if (!node.canConvertToInt()) {
                        throw new IllegalArgumentException("integer out of range");
                    }
                    return ParameterValue.integer(node.asInt());
                }
                if (node.isNumber()) {
                    throw new IllegalArgumentException("expected an integer");
                }
                return convertText(type, node.asText());
            }
            case DOUBLE -> {
                if (node.isNumber()) {
                    return ParameterValue.decimal(node.asDouble());
                }
                return convertText(type, node.asText());
            }
            case BOOLEAN -> {
                if (node.isBoolean()) {
                    return ParameterValue.bool(node.asBoolean());
                }
                return convertText(type, node.asText());
            }
            default -> {
                return ParameterValue.text(node.asText());
            }
        }
    }

    private static ParameterValue convertText(ParameterType type, String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("value is null");
        }
        String value = raw.trim();
        return switch (type) {
            case INT -> parseInteger(value);
            case DOUBLE -> parseDouble(value);
            case BOOLEAN -> ParameterValue.bool(parseBoolean(value));
            default -> ParameterValue.text(raw);
        };
    }

    private static ParameterValue parseInteger(String value) {
        try {
            return ParameterValue.integer(Integer.parseInt(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + value + "' is not an integer");
        }
    }

    private static ParameterValue parseDouble(String value) {
        double parsed;
        try {
            parsed = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + value + "' is not a number");
        }
        if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
            throw new IllegalArgumentException("'" + value + "' is not a finite number");
        }
        return ParameterValue.decimal(parsed);
    }

    static boolean parseBoolean(String raw) {
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1" -> true;
            case "false", "0" -> false;
            default -> throw new IllegalArgumentException("'" + raw + "' is not a boolean");
        };
    }

    private static Conversion validate(ParameterDefinition definition, ParameterValue value) {
        List<ParameterValue> scalars = value.kind() == ParameterValue.Kind.LIST
                ? ((ParameterValue.ListValue) value).items()
                : List.of(value);
        for (ParameterValue scalar : scalars) {
            Optional<ValidationError> error = validateScalar(definition, scalar);
            if (error.isPresent()) {
                return Conversion.failed(error.get());
            }
        }
        return Conversion.ok(value);
    }

    private static Optional<ValidationError> validateScalar(ParameterDefinition definition, ParameterValue scalar) {
        return switch (scalar.kind()) {
            case INTEGER -> checkRange(definition, ((ParameterValue.IntValue) scalar).value());
            case DOUBLE -> checkRange(definition, ((ParameterValue.DoubleValue) scalar).value());
            case TEXT -> checkText(definition, ((ParameterValue.TextValue) scalar).value());
            default -> Optional.empty();
        };
    }

    private static Optional<ValidationError> checkRange(ParameterDefinition definition, double number) {
        if (definition.min() != null && number < definition.min()) {
            return Optional.of(rangeError(definition, number));
        }
        if (definition.max() != null && number > definition.max()) {
            return Optional.of(rangeError(definition, number));
        }
        return Optional.empty();
    }

    private static Optional<ValidationError> checkText(ParameterDefinition definition, String text) {
        if (definition.type().elementType() == ParameterType.ENUM
                && definition.enumValues() != null
                && !definition.enumValues().contains(text)) {
            return Optional.of(ValidationError.of(
                    ErrorCodes.PARAMETER_ENUM_INVALID,
                    "Parameter '" + definition.name() + "' value '" + text + "' is not one of " + definition.enumValues(),
                    "parameter", definition.name(),
                    "allowed", definition.enumValues()
            ));
        }
        if (definition.pattern() != null && !definition.pattern().isEmpty()) {
            try {
                if (!Pattern.compile(definition.pattern()).matcher(text).matches()) {
                    return Optional.of(ValidationError.of(
                            ErrorCodes.PARAMETER_PATTERN_INVALID,
                            "Parameter '" + definition.name() + "' does not match pattern " + definition.pattern(),
                            "parameter", definition.name(),
                            "pattern", definition.pattern()
                    ));
                }
            } catch (PatternSyntaxException e) {
                return Optional.of(typeError(definition, "invalid pattern in manifest: " + e.getDescription()));
            }
        }
        return Optional.empty();
    }

    private static ValidationError rangeError(ParameterDefinition definition, double number) {
        return ValidationError.of(
                ErrorCodes.PARAMETER_RANGE_INVALID,
                "Parameter '" + definition.name() + "' value " + number + " is outside ["
                        + definition.min() + ", " + definition.max() + "]",
                "parameter", definition.name(),
                "min", definition.min(),
                "max", definition.max()
        );
    }

    private static ValidationError typeError(ParameterDefinition definition, String reason) {
        return ValidationError.of(
                ErrorCodes.PARAMETER_TYPE_INVALID,
                "Parameter '" + definition.name() + "' is not a valid " + definition.type().wireName() + ": " + reason,
                "parameter", definition.name(),
                "type", definition.type().wireName()
        );
    }

    public record Conversion(ParameterValue value, ValidationError error) {
        static Conversion ok(ParameterValue value) {
            return new Conversion(value, null);
        }

        static Conversion failed(ValidationError error) {
            return new Conversion(null, error);
        }

        public boolean succeeded() {
            return error == null;
        }
    }
}
