package com.cred.freestyle.promotions.api.dto;

import com.cred.freestyle.promotions.domain.model.Promotion;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

/**
 * Response DTO for a single promotion.
 * Dates are rendered as ISO-8601 calendar dates (YYYY-MM-DD).
 *
 * @author Promotions Team
 */
@Schema(description = "A promotion")
public class PromotionResponse {

    @Schema(description = "The unique id assigned by the service", example = "1", accessMode = Schema.AccessMode.READ_ONLY)
    @JsonProperty("id")
    private Long id;

    @Schema(description = "The name of the promotion", example = "Summer Sale 20% Off")
    @JsonProperty("name")
    private String name;

    @Schema(description = "The type of promotion", example = "PERCENT", allowableValues = {"BOGO", "DISCOUNT", "PERCENT"})
    @JsonProperty("promotion_type")
    private String promotionType;

    @Schema(description = "The value of the promotion", example = "20")
    @JsonProperty("value")
    private Integer value;

    @Schema(description = "The product ID this promotion applies to", example = "101")
    @JsonProperty("product_id")
    private Integer productId;

    @Schema(description = "The start date of the promotion", example = "2025-08-15")
    @JsonProperty("start_date")
    private String startDate;

    @Schema(description = "The end date of the promotion", example = "2025-08-31")
    @JsonProperty("end_date")
    private String endDate;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("last_updated")
    private Instant lastUpdated;

    public PromotionResponse() {
    }

    /**
     * Create response from Promotion entity.
     *
     * @param promotion Promotion entity
     * @return PromotionResponse
     */
    public static PromotionResponse fromEntity(Promotion promotion) {
        PromotionResponse response = new PromotionResponse();
        response.setId(promotion.getId());
        response.setName(promotion.getName());
        response.setPromotionType(promotion.getPromotionType() != null ? promotion.getPromotionType().name() : null);
        response.setValue(promotion.getValue());
        response.setProductId(promotion.getProductId());
        response.setStartDate(promotion.getStartDate() != null ? promotion.getStartDate().toString() : null);
        response.setEndDate(promotion.getEndDate() != null ? promotion.getEndDate().toString() : null);
        response.setCreatedAt(promotion.getCreatedAt());
        response.setLastUpdated(promotion.getLastUpdated());
        return response;
    }

    // Getters and setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getPromotionType() {
        return promotionType;
    }

    public void setPromotionType(String promotionType) {
        this.promotionType = promotionType;
    }

    public Integer getValue() {
        return value;
    }

    public void setValue(Integer value) {
        this.value = value;
    }

    public Integer getProductId() {
        return productId;
    }

    public void setProductId(Integer productId) {
        this.productId = productId;
    }

    public String getStartDate() {
        return startDate;
    }

    public void setStartDate(String startDate) {
        this.startDate = startDate;
    }

    public String getEndDate() {
        return endDate;
    }

    public void setEndDate(String endDate) {
        this.endDate = endDate;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(Instant lastUpdated) {
        this.lastUpdated = lastUpdated;
    }
}
