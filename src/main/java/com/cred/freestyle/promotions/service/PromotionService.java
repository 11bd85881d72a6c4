package com.cred.freestyle.promotions.service;

import com.cred.freestyle.promotions.domain.model.Promotion;
import com.cred.freestyle.promotions.domain.model.PromotionType;
import com.cred.freestyle.promotions.domain.validation.PromotionDraft;
import com.cred.freestyle.promotions.exception.DataValidationException;
import com.cred.freestyle.promotions.exception.DatabaseException;
import com.cred.freestyle.promotions.exception.InvalidQueryParameterException;
import com.cred.freestyle.promotions.exception.PromotionNotFoundException;
import com.cred.freestyle.promotions.infrastructure.metrics.PromotionMetricsService;
import com.cred.freestyle.promotions.repository.PromotionRepository;
import com.cred.freestyle.promotions.service.PromotionQuery.Filter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Service for managing promotions.
 * Handles list filtering, CRUD operations and the deactivate action.
 *
 * Persistence failures roll back the current transaction and surface as
 * {@link DatabaseException}, except for deactivate, which reports them as
 * {@link DataValidationException}.
 *
 * @author Promotions Team
 */
@Service
public class PromotionService {

    private static final Logger logger = LoggerFactory.getLogger(PromotionService.class);

    private final PromotionRepository promotionRepository;
    private final PromotionMetricsService metricsService;
    private final Clock clock;

    public PromotionService(
            PromotionRepository promotionRepository,
            PromotionMetricsService metricsService,
            Clock clock
    ) {
        this.promotionRepository = promotionRepository;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * List promotions using the first supplied filter of the query.
     *
     * @param query Raw list filters
     * @return Matching promotions, possibly empty
     * @throws InvalidQueryParameterException if the applied filter value is malformed
     */
    @Transactional(readOnly = true)
    public List<Promotion> findPromotions(PromotionQuery query) {
        Filter filter = query.appliedFilter();
        logger.debug("Listing promotions with filter: {}", filter.getParameter());

        List<Promotion> promotions;
        switch (filter) {
            case ID:
                promotions = findById(query.getId());
                break;
            case ACTIVE:
                promotions = findByActiveFlag(query.getActive());
                break;
            case NAME:
                promotions = promotionRepository.findByName(query.getName().trim());
                break;
            case PRODUCT_ID:
                promotions = findByProductId(query.getProductId());
                break;
            case PROMOTION_TYPE:
                promotions = findByPromotionType(query.getPromotionType());
                break;
            default:
                promotions = promotionRepository.findAll();
        }

        metricsService.recordQuery(filter.getParameter(), promotions.size());
        logger.debug("Found {} promotions for filter: {}", promotions.size(), filter.getParameter());
        return promotions;
    }

    private List<Promotion> findById(String rawId) {
        long id;
        try {
            id = Long.parseLong(rawId.trim());
        } catch (NumberFormatException e) {
            logger.debug("Non-numeric id filter '{}' matches nothing", rawId);
            return List.of();
        }
        return promotionRepository.findById(id)
                .map(List::of)
                .orElse(List.of());
    }

    private List<Promotion> findByActiveFlag(String rawActive) {
        boolean active = PromotionQuery.parseStrictBoolean(rawActive)
                .orElseThrow(() -> new InvalidQueryParameterException("active", rawActive,
                        "Invalid value for query parameter 'active'. "
                                + "Accepted: true, false, 1, 0, yes, no (case-insensitive). "
                                + "Received: '" + rawActive + "'"));

        LocalDate today = today();
        if (active) {
            logger.debug("Filtering promotions active on {}", today);
            return promotionRepository.findActiveOn(today);
        }
        logger.debug("Filtering promotions not active on {}", today);
        return promotionRepository.findInactiveOn(today);
    }

    private List<Promotion> findByProductId(String rawProductId) {
        int productId;
        try {
            productId = Integer.parseInt(rawProductId.trim());
        } catch (NumberFormatException e) {
            throw new InvalidQueryParameterException("product_id", rawProductId,
                    "Invalid value for query parameter 'product_id': " + rawProductId);
        }
        return promotionRepository.findByProductId(productId);
    }

    private List<Promotion> findByPromotionType(String rawType) {
        String type = rawType.trim();
        if (type.isEmpty()) {
            return List.of();
        }
        return PromotionType.fromName(type)
                .map(promotionRepository::findByPromotionType)
                .orElse(List.of());
    }

    /**
     * Find promotion by ID.
     *
     * @param id Promotion ID
     * @return Promotion if found
     */
    @Transactional(readOnly = true)
    public Optional<Promotion> findPromotionById(Long id) {
        logger.debug("Finding promotion by id: {}", id);
        return promotionRepository.findById(id);
    }

    /**
     * Get promotion by ID.
     *
     * @param id Promotion ID
     * @return the promotion
     * @throws PromotionNotFoundException if no promotion has this id
     */
    @Transactional(readOnly = true)
    public Promotion getPromotion(Long id) {
        return findPromotionById(id).orElseThrow(() -> new PromotionNotFoundException(id));
    }

    public boolean existsById(Long id) {
        return promotionRepository.existsById(id);
    }

    /**
     * Persist a new promotion built from a validated draft.
     *
     * @param draft Validated promotion attributes
     * @return the saved promotion with its generated id
     */
    @Transactional
    public Promotion createPromotion(PromotionDraft draft) {
        logger.info("Creating promotion: {}", draft.getName());
        long startTime = System.currentTimeMillis();

        Promotion saved;
        try {
            saved = promotionRepository.saveAndFlush(draft.toPromotion());
        } catch (DataAccessException e) {
            logger.error("Error creating promotion: {}", draft.getName(), e);
            metricsService.recordError("DATABASE_ERROR", "create");
            throw new DatabaseException("create", e);
        }

        metricsService.recordDatabaseLatency("create", System.currentTimeMillis() - startTime);
        metricsService.recordPromotionCreated(saved.getPromotionType().name());
        logger.info("Created promotion: {} with id: {}", saved.getName(), saved.getId());
        return saved;
    }

    /**
     * Replace every client-owned attribute of an existing promotion.
     * The id in the path is authoritative.
     *
     * @param id Promotion ID
     * @param draft Validated promotion attributes
     * @return the updated promotion
     * @throws PromotionNotFoundException if no promotion has this id
     */
    @Transactional
    public Promotion updatePromotion(Long id, PromotionDraft draft) {
        logger.info("Updating promotion with id: {}", id);
        Promotion promotion = getPromotion(id);
        draft.applyTo(promotion);

        Promotion saved;
        try {
            saved = promotionRepository.saveAndFlush(promotion);
        } catch (DataAccessException e) {
            logger.error("Error updating promotion with id: {}", id, e);
            metricsService.recordError("DATABASE_ERROR", "update");
            throw new DatabaseException("update", e);
        }

        metricsService.recordPromotionUpdated(saved.getPromotionType().name());
        logger.info("Updated promotion with id: {}", id);
        return saved;
    }

    /**
     * Hard-delete a promotion.
     *
     * @param id Promotion ID
     * @throws PromotionNotFoundException if no promotion has this id
     */
    @Transactional
    public void deletePromotion(Long id) {
        logger.info("Deleting promotion with id: {}", id);
        Promotion promotion = getPromotion(id);

        try {
            promotionRepository.delete(promotion);
            promotionRepository.flush();
        } catch (DataAccessException e) {
            logger.error("Error deleting promotion with id: {}", id, e);
            metricsService.recordError("DATABASE_ERROR", "delete");
            throw new DatabaseException("delete", e);
        }

        metricsService.recordPromotionDeleted(promotion.getPromotionType().name());
        logger.info("Deleted promotion with id: {}", id);
    }

    /**
     * End a promotion no later than yesterday. Never extends an end date
     * that is already in the past, so repeated calls are harmless.
     *
     * @param id Promotion ID
     * @return the deactivated promotion
     * @throws PromotionNotFoundException if no promotion has this id
     * @throws DataValidationException if the update cannot be stored
     */
    @Transactional
    public Promotion deactivatePromotion(Long id) {
        logger.info("Deactivating promotion with id: {}", id);
        Promotion promotion = getPromotion(id);
        promotion.deactivate(today());

        Promotion saved;
        try {
            saved = promotionRepository.saveAndFlush(promotion);
        } catch (DataAccessException e) {
            logger.error("Error deactivating promotion with id: {}", id, e);
            metricsService.recordError("DATABASE_ERROR", "deactivate");
            throw new DataValidationException("Unable to deactivate promotion " + id, e);
        }

        metricsService.recordPromotionDeactivated(saved.getPromotionType().name());
        logger.info("Deactivated promotion with id: {}, end date now: {}", id, saved.getEndDate());
        return saved;
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
