package com.cred.freestyle.promotions.api.controller;

import com.cred.freestyle.promotions.api.dto.PromotionResponse;
import com.cred.freestyle.promotions.domain.model.Promotion;
import com.cred.freestyle.promotions.domain.validation.PromotionDraft;
import com.cred.freestyle.promotions.domain.validation.PromotionValidator;
import com.cred.freestyle.promotions.domain.validation.ValidationResult;
import com.cred.freestyle.promotions.exception.DataValidationException;
import com.cred.freestyle.promotions.exception.PromotionNotFoundException;
import com.cred.freestyle.promotions.infrastructure.metrics.PromotionMetricsService;
import com.cred.freestyle.promotions.service.PromotionQuery;
import com.cred.freestyle.promotions.service.PromotionService;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for promotion operations.
 * Handles listing with filters, CRUD and the deactivate action.
 *
 * @author Promotions Team
 */
@RestController
@RequestMapping("/promotions")
@Tag(name = "Promotions", description = "Promotions operations")
public class PromotionController {

    private static final Logger logger = LoggerFactory.getLogger(PromotionController.class);

    private final PromotionService promotionService;
    private final PromotionValidator promotionValidator;
    private final PromotionMetricsService metricsService;

    public PromotionController(
            PromotionService promotionService,
            PromotionValidator promotionValidator,
            PromotionMetricsService metricsService
    ) {
        this.promotionService = promotionService;
        this.promotionValidator = promotionValidator;
        this.metricsService = metricsService;
    }

    /**
     * List promotions. Only the first supplied filter is applied, in the order
     * id, active, name, product_id, promotion_type; without filters all
     * promotions are returned.
     *
     * @return List of matching promotions
     */
    @GetMapping
    @Operation(summary = "List Promotions", description = "Returns promotions matching the first supplied filter")
    public ResponseEntity<List<PromotionResponse>> listPromotions(
            @Parameter(description = "Filter by promotion ID") @RequestParam(value = "id", required = false) String id,
            @Parameter(description = "Filter by active status (true/false/1/0/yes/no)") @RequestParam(value = "active", required = false) String active,
            @Parameter(description = "Filter by name") @RequestParam(value = "name", required = false) String name,
            @Parameter(description = "Filter by product ID") @RequestParam(value = "product_id", required = false) String productId,
            @Parameter(description = "Filter by promotion type") @RequestParam(value = "promotion_type", required = false) String promotionType
    ) {
        logger.info("Request to list promotions");

        PromotionQuery query = PromotionQuery.builder()
                .id(id)
                .active(active)
                .name(name)
                .productId(productId)
                .promotionType(promotionType)
                .build();

        List<PromotionResponse> responses = promotionService.findPromotions(query).stream()
                .map(PromotionResponse::fromEntity)
                .collect(Collectors.toList());

        logger.debug("Returning {} promotions", responses.size());
        return ResponseEntity.ok(responses);
    }

    /**
     * Create a promotion.
     *
     * @param body JSON promotion attributes
     * @return the created promotion, with a Location header
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Create a Promotion")
    @ApiResponse(responseCode = "201", description = "Promotion created")
    @ApiResponse(responseCode = "400", description = "Bad Request")
    @ApiResponse(responseCode = "415", description = "Unsupported Media Type")
    public ResponseEntity<PromotionResponse> createPromotion(@RequestBody JsonNode body) {
        logger.info("Request to create a promotion");
        logger.debug("Processing: {}", body);

        PromotionDraft draft = requireValid(promotionValidator.validateForCreate(body), "create");
        Promotion created = promotionService.createPromotion(draft);

        URI location = ServletUriComponentsBuilder.fromCurrentRequestUri()
                .path("/{id}")
                .buildAndExpand(created.getId())
                .toUri();

        return ResponseEntity.created(location).body(PromotionResponse.fromEntity(created));
    }

    /**
     * Get promotion by ID.
     *
     * @param id Promotion ID
     * @return the promotion, or 404
     */
    @GetMapping("/{id:\\d+}")
    @Operation(summary = "Get a Promotion")
    @ApiResponse(responseCode = "404", description = "Promotion not found")
    public ResponseEntity<PromotionResponse> getPromotion(@PathVariable Long id) {
        logger.info("Request to get promotion with id [{}]", id);

        return promotionService.findPromotionById(id)
                .map(PromotionResponse::fromEntity)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new PromotionNotFoundException(id));
    }

    /**
     * Replace a promotion. The path id is authoritative; a conflicting body id is rejected.
     *
     * @param id Promotion ID
     * @param body JSON promotion attributes
     * @return the updated promotion
     */
    @PutMapping(value = "/{id:\\d+}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Update a Promotion")
    @ApiResponse(responseCode = "400", description = "Bad Request")
    @ApiResponse(responseCode = "404", description = "Promotion not found")
    public ResponseEntity<PromotionResponse> updatePromotion(
            @PathVariable Long id,
            @RequestBody JsonNode body
    ) {
        logger.info("Request to update promotion with id [{}]", id);

        if (!promotionService.existsById(id)) {
            throw new PromotionNotFoundException(id);
        }

        PromotionDraft draft = requireValid(promotionValidator.validateForUpdate(body, id), "update");
        Promotion updated = promotionService.updatePromotion(id, draft);
        return ResponseEntity.ok(PromotionResponse.fromEntity(updated));
    }

    /**
     * Delete a promotion.
     *
     * @param id Promotion ID
     * @return 204 No Content
     */
    @DeleteMapping("/{id:\\d+}")
    @Operation(summary = "Delete a Promotion")
    @ApiResponse(responseCode = "204", description = "Promotion deleted")
    @ApiResponse(responseCode = "404", description = "Promotion not found")
    public ResponseEntity<Void> deletePromotion(@PathVariable Long id) {
        logger.info("Request to delete promotion with id [{}]", id);
        promotionService.deletePromotion(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * Deactivate a promotion by moving its end date back to yesterday.
     *
     * @param id Promotion ID
     * @return the deactivated promotion
     */
    @PutMapping("/{id:\\d+}/deactivate")
    @Operation(summary = "Deactivate a Promotion", description = "Sets the end date to yesterday unless it is already earlier")
    @ApiResponse(responseCode = "400", description = "Bad Request")
    @ApiResponse(responseCode = "404", description = "Promotion not found")
    public ResponseEntity<PromotionResponse> deactivatePromotion(@PathVariable Long id) {
        logger.info("Request to deactivate promotion with id [{}]", id);
        Promotion deactivated = promotionService.deactivatePromotion(id);
        return ResponseEntity.ok(PromotionResponse.fromEntity(deactivated));
    }

    private PromotionDraft requireValid(ValidationResult<PromotionDraft> result, String operation) {
        if (!result.isValid()) {
            logger.warn("Rejected promotion {} request: {}", operation, result.getError());
            metricsService.recordError("VALIDATION_ERROR", operation);
        }
        return result.orElseThrow(DataValidationException::new);
    }
}
