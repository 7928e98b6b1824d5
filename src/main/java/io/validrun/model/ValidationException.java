package io.validrun.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Carries every validation error found before a run was allowed to start.
 */
public final class ValidationException extends RuntimeException {
    private final List<ValidationError> errors;

    public ValidationException(ValidationError error) {
        this(List.of(error));
    }

    public ValidationException(List<ValidationError> errors) {
        super(errors.stream().map(ValidationError::toString).collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> errors() {
        return errors;
    }

    public boolean hasCode(String code) {
        return errors.stream().anyMatch(e -> e.code().equals(code));
    }
}
