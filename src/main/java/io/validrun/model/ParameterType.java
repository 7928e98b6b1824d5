package io.validrun.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ParameterType {
    STRING("string", false),
    INT("int", false),
    DOUBLE("double", false),
    BOOLEAN("boolean", false),
    ENUM("enum", false),
    PATH("path", false),
    FILE("file", false),
    FOLDER("folder", false),
    STRING_ARRAY("string[]", true),
    INT_ARRAY("int[]", true),
    DOUBLE_ARRAY("double[]", true),
    BOOLEAN_ARRAY("boolean[]", true),
    ENUM_ARRAY("enum[]", true),
    PATH_ARRAY("path[]", true),
    FILE_ARRAY("file[]", true),
    FOLDER_ARRAY("folder[]", true);

    private final String wireName;
    private final boolean array;

    ParameterType(String wireName, boolean array) {
        this.wireName = wireName;
        this.array = array;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isArray() {
        return array;
    }

    /**
     * Scalar type of an array variant, or this type for scalars.
     */
    public ParameterType elementType() {
        if (!array) {
            return this;
        }
        return fromString(wireName.substring(0, wireName.length() - 2));
    }

    public boolean isTextual() {
        ParameterType element = elementType();
        return element == STRING || element == ENUM || element == PATH || element == FILE || element == FOLDER;
    }

    @JsonCreator
    public static ParameterType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Parameter type is required");
        }
        String value = raw.trim().toLowerCase(java.util.Locale.ROOT);
        if (value.equals("bool")) {
            value = "boolean";
        } else if (value.equals("bool[]")) {
            value = "boolean[]";
        }
        for (ParameterType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown parameter type: " + raw);
    }
}
