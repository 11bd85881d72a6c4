package com.cred.freestyle.promotions.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ErrorResponse Tests")
class ErrorResponseTest {

    @Test
    @DisplayName("Constructor sets the status line fields and an empty details map")
    void constructor_SetsFields() {
        ErrorResponse response = new ErrorResponse(404, "Not Found", "Promotion not found: 7", "/promotions/7");

        assertThat(response.getStatus()).isEqualTo(404);
        assertThat(response.getError()).isEqualTo("Not Found");
        assertThat(response.getMessage()).isEqualTo("Promotion not found: 7");
        assertThat(response.getPath()).isEqualTo("/promotions/7");
        assertThat(response.getTimestamp()).isNotNull();
        assertThat(response.getDetails()).isEmpty();
    }

    @Test
    @DisplayName("addDetail keeps insertion order and skips null values")
    void addDetail_SkipsNulls() {
        ErrorResponse response = new ErrorResponse(400, "Bad Request", "Invalid value", "/promotions")
                .addDetail("kind", "INVALID_RANGE")
                .addDetail("field", null)
                .addDetail("value", -1);

        assertThat(response.getDetails()).containsExactly(
                entry("kind", "INVALID_RANGE"),
                entry("value", -1));
    }

    @Test
    @DisplayName("Serializes every property, details included")
    void serializesAllProperties() {
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        ErrorResponse response = new ErrorResponse(415, "Unsupported Media Type", "Unsupported", "/promotions")
                .addDetail("content_type", "text/plain");

        JsonNode json = objectMapper.valueToTree(response);

        assertThat(json.get("status").asInt()).isEqualTo(415);
        assertThat(json.get("error").asText()).isEqualTo("Unsupported Media Type");
        assertThat(json.get("path").asText()).isEqualTo("/promotions");
        assertThat(json.has("timestamp")).isTrue();
        assertThat(json.get("details").get("content_type").asText()).isEqualTo("text/plain");
    }
}
