package io.validrun.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Privilege {
    USER("User"),
    ADMIN_PREFERRED("AdminPreferred"),
    ADMIN_REQUIRED("AdminRequired");

    private final String wireName;

    Privilege(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Privilege max(Privilege a, Privilege b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    @JsonCreator
    public static Privilege fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return USER;
        }
        for (Privilege value : values()) {
            if (value.wireName.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown privilege: " + raw);
    }
}
