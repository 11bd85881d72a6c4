package com.cred.freestyle.promotions.exception;

/**
 * Exception thrown when no promotion exists with the requested id.
 *
 * @author Promotions Team
 */
public class PromotionNotFoundException extends ResourceNotFoundException {

    public PromotionNotFoundException(Long promotionId) {
        super("Promotion", String.valueOf(promotionId));
    }
}
