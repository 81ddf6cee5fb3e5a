package com.agentos.core.llm;

/**
 * Outcome of checking a response against an expected type. Exactly one of
 * {@code value} and {@code error} is set.
 */
public record ValidationResult<T>(T value, String error) {

    public static <T> ValidationResult<T> valid(T value) {
        return new ValidationResult<>(value, null);
    }

    public static <T> ValidationResult<T> invalid(String error) {
        return new ValidationResult<>(null, error);
    }

    public boolean isValid() {
        return error == null;
    }
}
