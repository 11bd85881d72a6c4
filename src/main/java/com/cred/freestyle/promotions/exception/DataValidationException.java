package com.cred.freestyle.promotions.exception;

import com.cred.freestyle.promotions.domain.validation.ValidationError;
import com.cred.freestyle.promotions.domain.validation.ValidationErrorKind;

/**
 * Exception thrown when client-supplied promotion data breaks a business rule.
 * Always maps to 400 Bad Request.
 *
 * @author Promotions Team
 */
public class DataValidationException extends RuntimeException {

    private final ValidationError error;

    public DataValidationException(ValidationError error) {
        super(error.getMessage());
        this.error = error;
    }

    public DataValidationException(String message, Throwable cause) {
        super(message, cause);
        this.error = null;
    }

    /**
     * @return the validation kind, or null when the failure did not come from the validator
     */
    public ValidationErrorKind getKind() {
        return error != null ? error.getKind() : null;
    }

    /**
     * @return the offending field, or null
     */
    public String getField() {
        return error != null ? error.getField() : null;
    }
}
