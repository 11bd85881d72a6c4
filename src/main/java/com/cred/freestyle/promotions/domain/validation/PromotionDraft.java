package com.cred.freestyle.promotions.domain.validation;

import com.cred.freestyle.promotions.domain.model.Promotion;
import com.cred.freestyle.promotions.domain.model.PromotionType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.validator.constraints.CodePointLength;

import java.time.LocalDate;

/**
 * Validated, typed promotion attributes as supplied by a client.
 * Carries no id and no audit timestamps; those belong to the server.
 * Range constraints are checked one property at a time by {@link PromotionValidator}.
 *
 * @author Promotions Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromotionDraft {

    @CodePointLength(max = Promotion.NAME_MAX_LENGTH, message = "Field 'name' must be at most {max} characters")
    private String name;

    private PromotionType promotionType;

    @Min(value = 0, message = "Invalid value: must be >= 0")
    private Integer value;

    @Positive(message = "Invalid product_id: must be > 0")
    private Integer productId;

    private LocalDate startDate;
    private LocalDate endDate;

    /**
     * Build a new, unsaved promotion from this draft.
     */
    public Promotion toPromotion() {
        Promotion promotion = new Promotion();
        applyTo(promotion);
        return promotion;
    }

    /**
     * Overwrite every client-owned attribute of the promotion (full replace).
     */
    public void applyTo(Promotion promotion) {
        promotion.setName(name);
        promotion.setPromotionType(promotionType);
        promotion.setValue(value);
        promotion.setProductId(productId);
        promotion.setStartDate(startDate);
        promotion.setEndDate(endDate);
    }
}
