package com.cred.freestyle.promotions.api.exception;

import com.cred.freestyle.promotions.api.dto.ErrorResponse;
import com.cred.freestyle.promotions.exception.*;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Global exception handler for the promotions API.
 * Converts every exception into a JSON {@link ErrorResponse}; stack traces never reach the client.
 *
 * @author Promotions Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle DataValidationException.
     * Returns 400 BAD REQUEST with the validation kind and field.
     */
    @ExceptionHandler(DataValidationException.class)
    public ResponseEntity<ErrorResponse> handleDataValidationException(
            DataValidationException ex,
            HttpServletRequest request
    ) {
        logger.warn("Data validation failed: {}", ex.getMessage());

        ErrorResponse error = build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request);
        if (ex.getKind() != null) {
            error.addDetail("kind", ex.getKind().name());
        }
        error.addDetail("field", ex.getField());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle InvalidQueryParameterException.
     * Returns 400 BAD REQUEST for unparsable list filters.
     */
    @ExceptionHandler(InvalidQueryParameterException.class)
    public ResponseEntity<ErrorResponse> handleInvalidQueryParameterException(
            InvalidQueryParameterException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid query parameter: {}", ex.getMessage());

        ErrorResponse error = build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request);
        error.addDetail("parameter", ex.getParameter());
        error.addDetail("value", ex.getRawValue());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle malformed or missing JSON bodies.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleMessageNotReadable(
            HttpMessageNotReadableException ex,
            HttpServletRequest request
    ) {
        logger.warn("Unreadable request body: {}", ex.getMessage());

        ErrorResponse error = build(HttpStatus.BAD_REQUEST, "Bad Request",
                "Request body must be valid JSON", request);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle arguments that cannot be converted.
     * A path id too large for a long names no resource, so it returns 404 NOT FOUND; anything else is 400.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            HttpServletRequest request
    ) {
        logger.warn("Argument type mismatch for '{}': {}", ex.getName(), ex.getValue());

        if (ex.getParameter().hasParameterAnnotation(PathVariable.class)) {
            ErrorResponse error = build(HttpStatus.NOT_FOUND, "Not Found",
                    "The requested URL was not found on the server.", request);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
        }

        ErrorResponse error = build(HttpStatus.BAD_REQUEST, "Bad Request",
                String.format("Invalid value for '%s': %s", ex.getName(), ex.getValue()), request);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle ResourceNotFoundException (including PromotionNotFoundException).
     * Returns 404 NOT FOUND.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource not found: {}", ex.getMessage());

        ErrorResponse error = build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request);
        error.addDetail("resourceType", ex.getResourceType());
        error.addDetail("resourceId", ex.getResourceId());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    /**
     * Handle requests to unmapped routes.
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFound(
            NoResourceFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("No route for {} {}", request.getMethod(), request.getRequestURI());

        ErrorResponse error = build(HttpStatus.NOT_FOUND, "Not Found",
                "The requested URL was not found on the server.", request);

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    /**
     * Returns 405 METHOD NOT ALLOWED for a known route called with the wrong method.
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Method not allowed: {}", ex.getMessage());

        ErrorResponse error = build(HttpStatus.METHOD_NOT_ALLOWED, "Method Not Allowed", ex.getMessage(), request);

        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(error);
    }

    /**
     * Returns 415 UNSUPPORTED MEDIA TYPE when a body is not application/json.
     */
    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaTypeNotSupported(
            HttpMediaTypeNotSupportedException ex,
            HttpServletRequest request
    ) {
        String received = ex.getContentType() != null ? ex.getContentType().toString() : "none";
        logger.warn("Unsupported media type: {}", received);

        ErrorResponse error = build(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported Media Type",
                "Content-Type must be application/json; received " + received, request);

        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE).body(error);
    }

    /**
     * Handle DatabaseException.
     * Returns 500 INTERNAL SERVER ERROR; the transaction has already been rolled back.
     */
    @ExceptionHandler(DatabaseException.class)
    public ResponseEntity<ErrorResponse> handleDatabaseException(
            DatabaseException ex,
            HttpServletRequest request
    ) {
        logger.error("Database error during {}", ex.getOperation(), ex);

        ErrorResponse error = build(HttpStatus.INTERNAL_SERVER_ERROR, "Database Error",
                "A database error occurred while processing the request.", request);
        error.addDetail("operation", ex.getOperation());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    /**
     * Handle all other uncaught exceptions.
     * Returns 500 INTERNAL SERVER ERROR.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error: ", ex);

        ErrorResponse error = build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again later.", request);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private static ErrorResponse build(HttpStatus status, String label, String message, HttpServletRequest request) {
        return new ErrorResponse(status.value(), label, message, request.getRequestURI());
    }
}
