package com.cred.freestyle.promotions.config;

import com.cred.freestyle.promotions.domain.model.PromotionType;
import com.cred.freestyle.promotions.domain.validation.PromotionDraft;
import com.cred.freestyle.promotions.domain.validation.PromotionValidator;
import com.cred.freestyle.promotions.exception.DataValidationException;
import com.cred.freestyle.promotions.repository.PromotionRepository;
import com.cred.freestyle.promotions.service.PromotionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads sample promotions on startup when {@code promotions.sample-data.enabled=true}.
 * With {@code promotions.sample-data.reset=true} every existing promotion is removed first.
 *
 * Samples go through the same validation and service path as API requests.
 * Dates are relative to today so that most samples are active and two have expired.
 *
 * @author Promotions Team
 */
@Component
@ConditionalOnProperty(name = "promotions.sample-data.enabled", havingValue = "true")
public class SampleDataLoader implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(SampleDataLoader.class);

    private final PromotionService promotionService;
    private final PromotionRepository promotionRepository;
    private final PromotionValidator promotionValidator;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean reset;

    public SampleDataLoader(
            PromotionService promotionService,
            PromotionRepository promotionRepository,
            PromotionValidator promotionValidator,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${promotions.sample-data.reset:false}") boolean reset
    ) {
        this.promotionService = promotionService;
        this.promotionRepository = promotionRepository;
        this.promotionValidator = promotionValidator;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.reset = reset;
    }

    @Override
    public void run(String... args) {
        if (reset) {
            long existing = promotionRepository.count();
            promotionRepository.deleteAllInBatch();
            logger.info("Removed {} existing promotions", existing);
        }

        logger.info("Loading sample data...");
        int created = 0;
        for (ObjectNode sample : samples(LocalDate.now(clock))) {
            PromotionDraft draft = promotionValidator.validateForCreate(sample)
                    .orElseThrow(DataValidationException::new);
            promotionService.createPromotion(draft);
            created++;
            logger.info("Created: {} ({})", draft.getName(), draft.getPromotionType());
        }
        logger.info("Loaded {} promotions into the database", created);
    }

    List<ObjectNode> samples(LocalDate today) {
        List<ObjectNode> samples = new ArrayList<>();

        samples.add(sample("Summer Sale 20% Off", PromotionType.PERCENT, 20, 101, today, today.plusDays(30)));
        samples.add(sample("Black Friday 50% Discount", PromotionType.PERCENT, 50, 102, today, today.plusDays(7)));
        samples.add(sample("Winter Clearance 30% Off", PromotionType.PERCENT, 30, 103,
                today.minusDays(10), today.plusDays(20)));

        samples.add(sample("Holiday Special $10 Off", PromotionType.DISCOUNT, 10, 201, today, today.plusDays(15)));
        samples.add(sample("New Customer $25 Discount", PromotionType.DISCOUNT, 25, 202, today, today.plusDays(60)));
        samples.add(sample("Flash Sale $5 Off", PromotionType.DISCOUNT, 5, 203, today, today.plusDays(3)));

        samples.add(sample("Buy One Get One Free", PromotionType.BOGO, 1, 301, today, today.plusDays(14)));
        samples.add(sample("BOGO 50% Off Second Item", PromotionType.BOGO, 50, 302, today, today.plusDays(21)));
        samples.add(sample("Weekend BOGO Special", PromotionType.BOGO, 1, 303,
                today.minusDays(5), today.plusDays(2)));

        // expired, for the inactive filter
        samples.add(sample("Expired Spring Sale", PromotionType.PERCENT, 25, 401,
                today.minusDays(60), today.minusDays(30)));
        samples.add(sample("Past Holiday Discount", PromotionType.DISCOUNT, 15, 402,
                today.minusDays(45), today.minusDays(15)));

        return samples;
    }

    private ObjectNode sample(String name, PromotionType type, int value, int productId,
                              LocalDate startDate, LocalDate endDate) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("name", name);
        node.put("promotion_type", type.name());
        node.put("value", value);
        node.put("product_id", productId);
        node.put("start_date", startDate.toString());
        node.put("end_date", endDate.toString());
        return node;
    }
}
