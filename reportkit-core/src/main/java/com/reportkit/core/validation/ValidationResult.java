package com.reportkit.core.validation;

import java.util.Optional;

/**
 * Outcome of validating a section: valid, or the first problem found.
 */
public final class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(null);

    private final String message;

    private ValidationResult(String message) {
        this.message = message;
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(String message) {
        return new ValidationResult(message);
    }

    public boolean isValid() {
        return message == null;
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    @Override
    public String toString() {
        return isValid() ? "valid" : "invalid: " + message;
    }
}
