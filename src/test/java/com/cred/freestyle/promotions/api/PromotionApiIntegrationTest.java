package com.cred.freestyle.promotions.api;

import com.cred.freestyle.promotions.domain.model.PromotionType;
import com.cred.freestyle.promotions.repository.PromotionRepository;
import com.cred.freestyle.promotions.testutil.TestDataBuilder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static com.cred.freestyle.promotions.testutil.TestDataBuilder.TODAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full-stack API integration tests for Promotion endpoints.
 * Runs against an in-memory H2 database with "today" fixed to 2025-08-15.
 */
@SpringBootTest(properties = {
    "spring.datasource.url=jdbc:h2:mem:promotionsdb",
    "spring.datasource.driver-class-name=org.h2.Driver",
    "spring.jpa.hibernate.ddl-auto=create-drop",
    "spring.jpa.show-sql=false",
    "promotions.sample-data.enabled=false"
})
@AutoConfigureMockMvc
@Transactional
@DisplayName("Promotion API Integration Tests")
class PromotionApiIntegrationTest {

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        @Primary
        Clock fixedClock() {
            return Clock.fixed(TODAY.atStartOfDay(ZoneOffset.UTC).toInstant(), ZoneId.of("UTC"));
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private PromotionRepository promotionRepository;

    @BeforeEach
    void setUp() {
        promotionRepository.deleteAll();
    }

    private long create(String json) throws Exception {
        MvcResult result = mockMvc.perform(post("/promotions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json))
                .andExpect(status().isCreated())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("id").asLong();
    }

    // ========================================
    // CRUD Tests
    // ========================================

    @Test
    @DisplayName("POST then GET returns the same field values")
    void createThenGet_RoundTrip() throws Exception {
        // Given
        String json = TestDataBuilder.promotion()
                .name("Holiday Special $10 Off")
                .promotionType(PromotionType.DISCOUNT)
                .value(10)
                .productId(201)
                .toJson();

        // When
        MvcResult created = mockMvc.perform(post("/promotions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json))
                .andExpect(status().isCreated())
                .andExpect(header().exists("Location"))
                .andExpect(jsonPath("$.id").isNumber())
                .andExpect(jsonPath("$.created_at").exists())
                .andExpect(jsonPath("$.last_updated").exists())
                .andReturn();
        long id = objectMapper.readTree(created.getResponse().getContentAsString()).get("id").asLong();

        // Then
        mockMvc.perform(get("/promotions/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id))
                .andExpect(jsonPath("$.name").value("Holiday Special $10 Off"))
                .andExpect(jsonPath("$.promotion_type").value("DISCOUNT"))
                .andExpect(jsonPath("$.value").value(10))
                .andExpect(jsonPath("$.product_id").value(201))
                .andExpect(jsonPath("$.start_date").value("2025-08-15"))
                .andExpect(jsonPath("$.end_date").value("2025-09-14"));
    }

    @Test
    @DisplayName("Created BOGO promotion is listed by the promotion_type filter")
    void createBogo_ListedByType() throws Exception {
        // Given
        long id = create("""
                {"name": "X", "promotion_type": "BOGO", "value": 1, "product_id": 9,
                 "start_date": "2025-08-15", "end_date": "2025-08-31"}
                """);
        create(TestDataBuilder.promotion().name("Other").toJson());

        // When / Then
        mockMvc.perform(get("/promotions").param("promotion_type", "BOGO"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value(id))
                .andExpect(jsonPath("$[0].name").value("X"));

        mockMvc.perform(get("/promotions").param("promotion_type", "  "))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));

        mockMvc.perform(get("/promotions").param("promotion_type", "FREESHIP"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    @DisplayName("Update replaces fields and keeps the id")
    void update_ReplacesFields() throws Exception {
        // Given
        long id = create(TestDataBuilder.promotion().toJson());

        // When / Then
        mockMvc.perform(put("/promotions/{id}", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TestDataBuilder.promotion()
                                .name("Black Friday 50% Discount").value(50).productId(102).toJson()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id))
                .andExpect(jsonPath("$.name").value("Black Friday 50% Discount"))
                .andExpect(jsonPath("$.value").value(50));
    }

    @Test
    @DisplayName("Update with mismatched body id returns 400 and leaves the record unchanged")
    void update_IdMismatch_NoMutation() throws Exception {
        // Given
        long id = create(TestDataBuilder.promotion().name("Original").toJson());

        // When
        mockMvc.perform(put("/promotions/{id}", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"id": %d, "name": "Changed", "promotion_type": "PERCENT", "value": 5,
                                 "product_id": 1, "start_date": "2025-08-15", "end_date": "2025-08-16"}
                                """.formatted(id + 1)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("ID in body must match resource path"));

        // Then
        mockMvc.perform(get("/promotions/{id}", id))
                .andExpect(jsonPath("$.name").value("Original"));
    }

    @Test
    @DisplayName("Update of unknown promotion returns 404")
    void update_NotFound() throws Exception {
        mockMvc.perform(put("/promotions/{id}", 424242)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TestDataBuilder.promotion().toJson()))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Delete then delete again returns 204 then 404")
    void delete_Twice() throws Exception {
        // Given
        long id = create(TestDataBuilder.promotion().toJson());

        // When / Then
        mockMvc.perform(delete("/promotions/{id}", id))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/promotions/{id}", id))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/promotions/{id}", id))
                .andExpect(status().isNotFound());
    }

    // ========================================
    // Filter Tests
    // ========================================

    @Test
    @DisplayName("active=true and active=false partition the collection")
    void activeFilter_Partitions() throws Exception {
        // Given
        long running = create(TestDataBuilder.promotion().name("Running").toJson());
        long expired = create(TestDataBuilder.promotion().name("Expired").expired().toJson());
        long upcoming = create(TestDataBuilder.promotion().name("Upcoming").upcoming().toJson());

        // When / Then
        mockMvc.perform(get("/promotions").param("active", " TRUE "))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].id", contains((int) running)));

        mockMvc.perform(get("/promotions").param("active", "no"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].id", containsInAnyOrder((int) expired, (int) upcoming)));

        mockMvc.perform(get("/promotions"))
                .andExpect(jsonPath("$", hasSize(3)));
    }

    @Test
    @DisplayName("Invalid active value returns 400")
    void activeFilter_Invalid() throws Exception {
        mockMvc.perform(get("/promotions").param("active", "maybe"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("Received: 'maybe'")));
    }

    @Test
    @DisplayName("id filter returns at most one record and wins over other filters")
    void idFilter() throws Exception {
        // Given
        long id = create(TestDataBuilder.promotion().name("Target").toJson());
        create(TestDataBuilder.promotion().name("Other").toJson());

        // When / Then
        mockMvc.perform(get("/promotions").param("id", String.valueOf(id)).param("name", "Other"))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].name").value("Target"));

        mockMvc.perform(get("/promotions").param("id", "abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    @DisplayName("name and product_id filters")
    void nameAndProductFilters() throws Exception {
        // Given
        create(TestDataBuilder.promotion().name("Flash Sale $5 Off").productId(203).toJson());
        create(TestDataBuilder.promotion().name("Winter Clearance 30% Off").productId(203).toJson());

        // When / Then
        mockMvc.perform(get("/promotions").param("name", "Flash Sale $5 Off"))
                .andExpect(jsonPath("$", hasSize(1)));

        mockMvc.perform(get("/promotions").param("product_id", "203"))
                .andExpect(jsonPath("$", hasSize(2)));

        mockMvc.perform(get("/promotions").param("product_id", "abc"))
                .andExpect(status().isBadRequest());
    }

    // ========================================
    // Deactivate Tests
    // ========================================

    @Test
    @DisplayName("Deactivate sets end date to yesterday and is idempotent")
    void deactivate_Idempotent() throws Exception {
        // Given
        long id = create(TestDataBuilder.promotion().toJson());

        // When / Then
        mockMvc.perform(put("/promotions/{id}/deactivate", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.end_date").value("2025-08-14"));
        mockMvc.perform(put("/promotions/{id}/deactivate", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.end_date").value("2025-08-14"));

        mockMvc.perform(get("/promotions").param("active", "true"))
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    @DisplayName("Deactivate never moves a past end date forward")
    void deactivate_KeepsPastEndDate() throws Exception {
        // Given
        long id = create(TestDataBuilder.promotion().expired().toJson());

        // When / Then
        mockMvc.perform(put("/promotions/{id}/deactivate", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.end_date").value(TODAY.minusDays(30).toString()));
    }

    // ========================================
    // Error handler Tests
    // ========================================

    @Test
    @DisplayName("Unmapped route returns 404 JSON")
    void unknownRoute_Returns404() throws Exception {
        mockMvc.perform(get("/foo"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.error").value("Not Found"));
    }

    @Test
    @DisplayName("Non-numeric promotion id in the path returns 404")
    void nonNumericPathId_Returns404() throws Exception {
        mockMvc.perform(get("/promotions/abc"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("PUT on the collection returns 405")
    void putCollection_Returns405() throws Exception {
        mockMvc.perform(put("/promotions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isMethodNotAllowed());
    }

    @Test
    @DisplayName("Create with text/html returns 415")
    void create_WrongContentType_Returns415() throws Exception {
        mockMvc.perform(post("/promotions")
                        .contentType(MediaType.TEXT_HTML)
                        .content("not json"))
                .andExpect(status().isUnsupportedMediaType());
    }

    @Test
    @DisplayName("Create with a charset parameter on application/json returns 201")
    void create_JsonWithCharset_Returns201() throws Exception {
        mockMvc.perform(post("/promotions")
                        .header("Content-Type", "application/json; charset=UTF-8")
                        .content(TestDataBuilder.promotion().toJson()))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").isNumber());
    }

    @Test
    @DisplayName("Update with text/plain returns 415 and leaves the record unchanged")
    void update_WrongContentType_Returns415() throws Exception {
        // Given
        long id = create(TestDataBuilder.promotion().name("Untouched").toJson());

        // When
        mockMvc.perform(put("/promotions/{id}", id)
                        .contentType(MediaType.TEXT_PLAIN)
                        .content(TestDataBuilder.promotion().name("Changed").toJson()))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.message", containsString("text/plain")));

        // Then
        mockMvc.perform(get("/promotions/{id}", id))
                .andExpect(jsonPath("$.name").value("Untouched"));
    }

    @Test
    @DisplayName("Location header of a created promotion carries no query string")
    void create_LocationWithoutQueryString() throws Exception {
        mockMvc.perform(post("/promotions?x=1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TestDataBuilder.promotion().toJson()))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", not(containsString("?"))))
                .andExpect(header().string("Location", containsString("/promotions/")));
    }

    @Test
    @DisplayName("Path id too large for a long returns 404")
    void oversizedPathId_Returns404() throws Exception {
        mockMvc.perform(get("/promotions/99999999999999999999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    @DisplayName("Admin page lists everything when the product search box is empty")
    void adminScript_OmitsEmptyProductFilter() throws Exception {
        // Given
        create(TestDataBuilder.promotion().productId(203).toJson());

        // An empty product_id is rejected, so the page must leave it out
        mockMvc.perform(get("/promotions?product_id="))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/promotions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)));

        mockMvc.perform(get("/js/app.js"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("productId ? param('product_id', productId) : ''")));
    }

    @Test
    @DisplayName("Health and API index are served")
    void serviceEndpoints() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OK"));
        mockMvc.perform(get("/api"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Promotions Service"));
    }

    @Test
    @DisplayName("Timestamps are serialized as ISO-8601 strings")
    void timestampsAsIsoStrings() throws Exception {
        // Given
        long id = create(TestDataBuilder.promotion().toJson());

        // When
        MvcResult result = mockMvc.perform(get("/promotions/{id}", id)).andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());

        // Then
        assertThat(body.get("created_at").isTextual()).isTrue();
    }
}
