package io.validrun.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.List;

/**
 * Typed input value. Every implementation reports its {@link Kind} so callers switch on the tag
 * instead of inspecting runtime classes.
 */
public interface ParameterValue {
    enum Kind {
        TEXT,
        INTEGER,
        DOUBLE,
        BOOLEAN,
        LIST
    }

    Kind kind();

    JsonNode toJson();

    /**
     * Plain text form, as used for command-line arguments and redaction.
     */
    String asText();

    static ParameterValue text(String value) {
        return new TextValue(value);
    }

    static ParameterValue integer(long value) {
        return new IntValue(value);
    }

    static ParameterValue decimal(double value) {
        return new DoubleValue(value);
    }

    static ParameterValue bool(boolean value) {
        return new BoolValue(value);
    }

    static ParameterValue list(List<ParameterValue> items) {
        return new ListValue(items);
    }

    record TextValue(String value) implements ParameterValue {
        @Override
        public Kind kind() {
            return Kind.TEXT;
        }

        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.textNode(value);
        }

        @Override
        public String asText() {
            return value;
        }
    }

    record IntValue(long value) implements ParameterValue {
        @Override
        public Kind kind() {
            return Kind.INTEGER;
        }

        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.numberNode(value);
        }

        @Override
        public String asText() {
            return Long.toString(value);
        }
    }

    record DoubleValue(double value) implements ParameterValue {
        @Override
        public Kind kind() {
            return Kind.DOUBLE;
        }

        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.numberNode(value);
        }

        @Override
        public String asText() {
            return Double.toString(value);
        }
    }

    record BoolValue(boolean value) implements ParameterValue {
        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }

        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.booleanNode(value);
        }

        @Override
        public String asText() {
            return value ? "true" : "false";
        }
    }

    record ListValue(List<ParameterValue> items) implements ParameterValue {
        public ListValue {
            items = List.copyOf(items);
        }

        @Override
        public Kind kind() {
            return Kind.LIST;
        }

        @Override
        public JsonNode toJson() {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            for (ParameterValue item : items) {
                array.add(item.toJson());
            }
            return array;
        }

        @Override
        public String asText() {
            return toJson().toString();
        }
    }
}
