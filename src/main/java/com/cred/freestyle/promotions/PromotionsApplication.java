package com.cred.freestyle.promotions;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the Promotions service.
 *
 * System Overview:
 * - CRUD REST API for promotions (discount campaigns tied to a product)
 * - Mutually exclusive list filters: id, active, name, product_id, promotion_type
 * - Deactivate action that ends a promotion yesterday
 * - Static admin UI at / and Swagger UI at /apidocs
 *
 * Architecture:
 * - API Layer: REST controllers, JSON validation, global exception handler
 * - Service Layer: filter dispatch and transactional CRUD
 * - Data Access Layer: Spring Data JPA repository
 * - Infrastructure Layer: Micrometer metrics (CloudWatch optional)
 *
 * @author Promotions Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
public class PromotionsApplication {

    public static void main(String[] args) {
        SpringApplication.run(PromotionsApplication.class, args);
    }
}
