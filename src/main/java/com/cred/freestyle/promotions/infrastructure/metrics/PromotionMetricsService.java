package com.cred.freestyle.promotions.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Metrics service for the promotions API.
 * Records lifecycle counters, list-query usage and errors via Micrometer.
 * Metrics go to CloudWatch when it is enabled, otherwise to an in-memory registry.
 *
 * @author Promotions Team
 */
@Service
public class PromotionMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(PromotionMetricsService.class);

    private static final String METRIC_PREFIX = "promotions.";
    private static final String LIFECYCLE_PREFIX = METRIC_PREFIX + "lifecycle.";
    private static final String QUERY_PREFIX = METRIC_PREFIX + "query.";

    private final MeterRegistry meterRegistry;

    public PromotionMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record a promotion creation.
     *
     * @param promotionType Type of the created promotion
     */
    public void recordPromotionCreated(String promotionType) {
        recordLifecycleEvent("created", promotionType);
    }

    public void recordPromotionUpdated(String promotionType) {
        recordLifecycleEvent("updated", promotionType);
    }

    public void recordPromotionDeleted(String promotionType) {
        recordLifecycleEvent("deleted", promotionType);
    }

    public void recordPromotionDeactivated(String promotionType) {
        recordLifecycleEvent("deactivated", promotionType);
    }

    private void recordLifecycleEvent(String event, String promotionType) {
        Counter.builder(LIFECYCLE_PREFIX + event)
                .tag("promotion_type", promotionType)
                .description("Promotions " + event)
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded promotion {} for type: {}", event, promotionType);
    }

    /**
     * Record a list query and the filter that served it.
     *
     * @param filter Applied filter ("all", "id", "active", ...)
     * @param resultCount Number of promotions returned
     */
    public void recordQuery(String filter, int resultCount) {
        Counter.builder(QUERY_PREFIX + "count")
                .tag("filter", filter)
                .description("Promotion list queries")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded query with filter: {}, results: {}", filter, resultCount);
    }

    /**
     * Record database operation latency.
     *
     * @param operation Operation name (e.g., "create", "update")
     * @param durationMs Duration in milliseconds
     */
    public void recordDatabaseLatency(String operation, long durationMs) {
        Timer.builder(METRIC_PREFIX + "database.latency")
                .tag("operation", operation)
                .description("Database operation latency")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record error occurrence.
     *
     * @param errorType Error type (e.g., "DATABASE_ERROR", "VALIDATION_ERROR")
     * @param operation Operation where error occurred
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "error")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("Promotion API errors")
                .register(meterRegistry)
                .increment();
        logger.warn("Recorded error: type={}, operation={}", errorType, operation);
    }
}
