package io.validrun.model;

import java.util.Optional;

/**
 * {@code id@version}, unique per entity kind.
 */
public record Identity(String id, String version) {
    public Identity {
        if (id == null || id.isBlank() || version == null || version.isBlank()) {
            throw new IllegalArgumentException("identity requires id and version");
        }
        id = id.trim();
        version = version.trim();
    }

    public static Optional<Identity> tryParse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim();
        int at = value.indexOf('@');
        if (at <= 0 || at != value.lastIndexOf('@') || at == value.length() - 1) {
            return Optional.empty();
        }
        String id = value.substring(0, at).trim();
        String version = value.substring(at + 1).trim();
        if (id.isEmpty() || version.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Identity(id, version));
    }

    public static Identity parse(String raw) {
        return tryParse(raw).orElseThrow(() -> new ValidationException(ValidationError.of(
                ErrorCodes.RUN_REQUEST_IDENTITY_INVALID_FORMAT,
                "Identity must be id@version: " + raw
        )));
    }

    @Override
    public String toString() {
        return id + "@" + version;
    }
}
