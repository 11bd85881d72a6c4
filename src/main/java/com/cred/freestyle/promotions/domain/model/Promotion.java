package com.cred.freestyle.promotions.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Promotion entity representing a discount campaign for a single product.
 * A promotion is valid between its start and end dates, both inclusive.
 *
 * @author Promotions Team
 */
@Entity
@Table(name = "promotions", indexes = {
    @Index(name = "idx_promotion_name", columnList = "name"),
    @Index(name = "idx_promotion_product", columnList = "product_id"),
    @Index(name = "idx_promotion_type", columnList = "promotion_type"),
    @Index(name = "idx_promotion_dates", columnList = "start_date, end_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Promotion {

    public static final int NAME_MAX_LENGTH = 63;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", nullable = false, length = NAME_MAX_LENGTH)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "promotion_type", nullable = false, length = 63)
    private PromotionType promotionType;

    /**
     * Meaning depends on the type: a percentage for PERCENT, an amount for
     * DISCOUNT, a free quantity for BOGO.
     */
    @Column(name = "promotion_value", nullable = false)
    private Integer value;

    /**
     * Plain reference to the product catalog; not enforced as a foreign key.
     */
    @Column(name = "product_id", nullable = false)
    private Integer productId;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_updated", nullable = false)
    private Instant lastUpdated;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        lastUpdated = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        lastUpdated = Instant.now();
    }

    /**
     * Check whether this promotion is running on the given date.
     *
     * @param date Date to check
     * @return true if startDate <= date <= endDate
     */
    public boolean isActiveOn(LocalDate date) {
        return startDate != null && endDate != null
                && !date.isBefore(startDate)
                && !date.isAfter(endDate);
    }

    /**
     * End the promotion no later than the day before {@code today}.
     * An end date already in the past is left untouched, so repeated calls
     * yield the same end date.
     *
     * @param today Current date
     */
    public void deactivate(LocalDate today) {
        LocalDate yesterday = today.minusDays(1);
        if (endDate == null || endDate.isAfter(yesterday)) {
            endDate = yesterday;
        }
    }
}
