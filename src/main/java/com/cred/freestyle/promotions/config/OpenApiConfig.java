package com.cred.freestyle.promotions.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI document metadata. Swagger UI is served at /apidocs.
 *
 * @author Promotions Team
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI promotionsOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Promotions REST API Service")
                        .description("This is a Promotions service for managing promotional campaigns.")
                        .version("1.0.0")
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .tags(List.of(
                        new Tag().name("Promotions").description("Promotions operations"),
                        new Tag().name("Service").description("Health and service information")));
    }
}
