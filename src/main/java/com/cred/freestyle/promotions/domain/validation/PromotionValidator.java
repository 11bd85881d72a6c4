package com.cred.freestyle.promotions.domain.validation;

import com.cred.freestyle.promotions.domain.model.PromotionType;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.Set;

/**
 * Turns an untyped JSON payload into a {@link PromotionDraft}, enforcing the
 * promotion business rules. Fields are checked in a fixed order and the
 * first failure is reported.
 *
 * Presence and JSON types are checked on the raw payload; value ranges come
 * from the Bean Validation constraints declared on {@link PromotionDraft}.
 * Client input problems are returned as an invalid {@link ValidationResult},
 * never thrown.
 *
 * @author Promotions Team
 */
@Component
public class PromotionValidator {

    static final String NAME = "name";
    static final String PROMOTION_TYPE = "promotion_type";
    static final String VALUE = "value";
    static final String PRODUCT_ID = "product_id";
    static final String START_DATE = "start_date";
    static final String END_DATE = "end_date";
    static final String ID = "id";

    private final Validator beanValidator;

    public PromotionValidator(Validator beanValidator) {
        this.beanValidator = beanValidator;
    }

    /**
     * Validate a payload for creating a promotion. Any "id" in the body is ignored.
     *
     * @param body Request body
     * @return the draft, or the first validation error
     */
    public ValidationResult<PromotionDraft> validateForCreate(JsonNode body) {
        return validate(body);
    }

    /**
     * Validate a payload for replacing the promotion identified by {@code pathId}.
     * A body "id" that differs from the path id is rejected before the fields are checked.
     *
     * @param body Request body
     * @param pathId Id taken from the resource path
     * @return the draft, or the first validation error
     */
    public ValidationResult<PromotionDraft> validateForUpdate(JsonNode body, Long pathId) {
        if (body != null && body.isObject() && body.has(ID)) {
            String bodyId = body.get(ID).asText();
            if (!String.valueOf(pathId).equals(bodyId)) {
                return ValidationResult.invalid(ValidationErrorKind.ID_MISMATCH, ID,
                        "ID in body must match resource path");
            }
        }
        return validate(body);
    }

    private ValidationResult<PromotionDraft> validate(JsonNode body) {
        if (body == null || !body.isObject()) {
            return ValidationResult.invalid(ValidationErrorKind.INVALID_ATTRIBUTE, null,
                    "Invalid attribute: request body must be a JSON object");
        }

        ValidationResult<String> name = requireName(body);
        if (!name.isValid()) {
            return ValidationResult.invalid(name.getError());
        }

        ValidationResult<PromotionType> type = requirePromotionType(body);
        if (!type.isValid()) {
            return ValidationResult.invalid(type.getError());
        }

        ValidationResult<Integer> value = requireInt(body, VALUE);
        if (value.isValid()) {
            value = checkRange("value", VALUE, value.getValue());
        }
        if (!value.isValid()) {
            return ValidationResult.invalid(value.getError());
        }

        ValidationResult<Integer> productId = requireInt(body, PRODUCT_ID);
        if (productId.isValid()) {
            productId = checkRange("productId", PRODUCT_ID, productId.getValue());
        }
        if (!productId.isValid()) {
            return ValidationResult.invalid(productId.getError());
        }

        ValidationResult<LocalDate> startDate = requireIsoDate(body, START_DATE);
        if (!startDate.isValid()) {
            return ValidationResult.invalid(startDate.getError());
        }

        ValidationResult<LocalDate> endDate = requireIsoDate(body, END_DATE);
        if (!endDate.isValid()) {
            return ValidationResult.invalid(endDate.getError());
        }

        if (startDate.getValue().isAfter(endDate.getValue())) {
            return ValidationResult.invalid(ValidationErrorKind.INVALID_RANGE, START_DATE,
                    "Invalid date range: start_date must not be after end_date");
        }

        return ValidationResult.valid(PromotionDraft.builder()
                .name(name.getValue())
                .promotionType(type.getValue())
                .value(value.getValue())
                .productId(productId.getValue())
                .startDate(startDate.getValue())
                .endDate(endDate.getValue())
                .build());
    }

    private ValidationResult<String> requireName(JsonNode body) {
        ValidationResult<String> name = requireString(body, NAME);
        if (!name.isValid()) {
            return name;
        }
        if (name.getValue().isBlank()) {
            return ValidationResult.invalid(ValidationErrorKind.MISSING_FIELD, NAME,
                    "Invalid promotion: name must not be empty");
        }
        return checkRange("name", NAME, name.getValue());
    }

    /**
     * Check one value against the constraints of the matching draft property.
     */
    private <T> ValidationResult<T> checkRange(String property, String field, T value) {
        Set<ConstraintViolation<PromotionDraft>> violations =
                beanValidator.validateValue(PromotionDraft.class, property, value);
        if (violations.isEmpty()) {
            return ValidationResult.valid(value);
        }
        return ValidationResult.invalid(ValidationErrorKind.INVALID_RANGE, field,
                violations.iterator().next().getMessage());
    }

    private ValidationResult<PromotionType> requirePromotionType(JsonNode body) {
        ValidationResult<String> raw = requireString(body, PROMOTION_TYPE);
        if (!raw.isValid()) {
            return ValidationResult.invalid(raw.getError());
        }
        Optional<PromotionType> type = PromotionType.fromName(raw.getValue());
        if (type.isEmpty()) {
            return ValidationResult.invalid(ValidationErrorKind.INVALID_ENUM, PROMOTION_TYPE,
                    String.format("Invalid promotion_type '%s'. Allowed: %s",
                            raw.getValue(), PromotionType.allowedNames()));
        }
        return ValidationResult.valid(type.get());
    }

    private static ValidationResult<String> requireString(JsonNode body, String field) {
        if (!body.has(field)) {
            return missing(field);
        }
        JsonNode node = body.get(field);
        if (!node.isTextual()) {
            return ValidationResult.invalid(ValidationErrorKind.TYPE_MISMATCH, field,
                    String.format("Field '%s' must be a string", field));
        }
        return ValidationResult.valid(node.textValue());
    }

    private static ValidationResult<Integer> requireInt(JsonNode body, String field) {
        if (!body.has(field)) {
            return missing(field);
        }
        JsonNode node = body.get(field);
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            return ValidationResult.invalid(ValidationErrorKind.TYPE_MISMATCH, field,
                    String.format("Field '%s' must be an integer", field));
        }
        return ValidationResult.valid(node.intValue());
    }

    private static ValidationResult<LocalDate> requireIsoDate(JsonNode body, String field) {
        if (!body.has(field)) {
            return missing(field);
        }
        JsonNode node = body.get(field);
        String message = String.format("Field '%s' must be an ISO date (YYYY-MM-DD)", field);
        if (!node.isTextual()) {
            return ValidationResult.invalid(ValidationErrorKind.INVALID_DATE, field, message);
        }
        try {
            return ValidationResult.valid(LocalDate.parse(node.textValue()));
        } catch (DateTimeParseException e) {
            return ValidationResult.invalid(ValidationErrorKind.INVALID_DATE, field, message);
        }
    }

    private static <T> ValidationResult<T> missing(String field) {
        return ValidationResult.invalid(ValidationErrorKind.MISSING_FIELD, field,
                "Invalid promotion: missing " + field);
    }
}
