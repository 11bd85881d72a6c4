package com.cred.freestyle.promotions.domain.validation;

/**
 * A single validation failure: what went wrong, on which field, and a
 * message suitable for the API client.
 *
 * @author Promotions Team
 */
public class ValidationError {

    private final ValidationErrorKind kind;
    private final String field;
    private final String message;

    public ValidationError(ValidationErrorKind kind, String field, String message) {
        this.kind = kind;
        this.field = field;
        this.message = message;
    }

    public ValidationErrorKind getKind() {
        return kind;
    }

    /**
     * @return the offending field, or null when the error concerns the whole body
     */
    public String getField() {
        return field;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
