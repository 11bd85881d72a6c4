package com.cred.freestyle.promotions.api.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service metadata endpoints: liveness check and API index.
 * Neither touches the database.
 *
 * @author Promotions Team
 */
@RestController
@Tag(name = "Service", description = "Health and service information")
public class HealthController {

    private static final Logger logger = LoggerFactory.getLogger(HealthController.class);

    static final String SERVICE_NAME = "Promotions Service";
    static final String SERVICE_VERSION = "1.0.0";

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Liveness and readiness check")
    public ResponseEntity<Map<String, String>> health() {
        logger.debug("Health check requested");
        return ResponseEntity.ok(Map.of("status", "OK"));
    }

    @GetMapping("/api")
    @Operation(summary = "API information")
    public ResponseEntity<Map<String, Object>> apiIndex() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", SERVICE_NAME);
        info.put("version", SERVICE_VERSION);
        info.put("description", "RESTful service for managing promotions");
        info.put("paths", Map.of("promotions", "/promotions"));
        return ResponseEntity.ok(info);
    }
}
