package com.cred.freestyle.promotions.domain.validation;

/**
 * Categories of client input problems detected while validating a promotion.
 *
 * @author Promotions Team
 */
public enum ValidationErrorKind {

    /**
     * The request body is not a JSON object.
     */
    INVALID_ATTRIBUTE,

    /**
     * A required field is absent (or blank, for the name).
     */
    MISSING_FIELD,

    /**
     * A field has the wrong JSON type.
     */
    TYPE_MISMATCH,

    /**
     * A value outside the allowed set of promotion types.
     */
    INVALID_ENUM,

    /**
     * A number or date range outside its allowed bounds.
     */
    INVALID_RANGE,

    /**
     * A date that is not an ISO-8601 calendar date.
     */
    INVALID_DATE,

    /**
     * The body id disagrees with the resource path id.
     */
    ID_MISMATCH
}
