package com.cred.freestyle.promotions.exception;

/**
 * Exception thrown when a list filter parameter cannot be interpreted.
 *
 * @author Promotions Team
 */
public class InvalidQueryParameterException extends RuntimeException {

    private final String parameter;
    private final String rawValue;

    public InvalidQueryParameterException(String parameter, String rawValue, String message) {
        super(message);
        this.parameter = parameter;
        this.rawValue = rawValue;
    }

    public String getParameter() {
        return parameter;
    }

    public String getRawValue() {
        return rawValue;
    }
}
