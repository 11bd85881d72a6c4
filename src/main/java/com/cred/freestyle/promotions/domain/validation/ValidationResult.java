package com.cred.freestyle.promotions.domain.validation;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a validation: either a valid value or a {@link ValidationError}.
 *
 * @param <T> Type of the validated value
 * @author Promotions Team
 */
public final class ValidationResult<T> {

    private final T value;
    private final ValidationError error;

    private ValidationResult(T value, ValidationError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ValidationResult<T> valid(T value) {
        return new ValidationResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ValidationResult<T> invalid(ValidationError error) {
        return new ValidationResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> ValidationResult<T> invalid(ValidationErrorKind kind, String field, String message) {
        return invalid(new ValidationError(kind, field, message));
    }

    public boolean isValid() {
        return error == null;
    }

    /**
     * @throws IllegalStateException if the result is invalid
     */
    public T getValue() {
        if (!isValid()) {
            throw new IllegalStateException("No value present: " + error);
        }
        return value;
    }

    /**
     * @throws IllegalStateException if the result is valid
     */
    public ValidationError getError() {
        if (isValid()) {
            throw new IllegalStateException("Result is valid");
        }
        return error;
    }

    /**
     * Return the value, or throw the exception built from the error.
     */
    public <X extends RuntimeException> T orElseThrow(Function<ValidationError, X> exceptionFactory) {
        if (!isValid()) {
            throw exceptionFactory.apply(error);
        }
        return value;
    }
}
