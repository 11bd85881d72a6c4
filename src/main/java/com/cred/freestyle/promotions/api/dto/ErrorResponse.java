package com.cred.freestyle.promotions.api.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON body of every error returned by the promotions API.
 * {@code details} carries the validation kind and field, the offending query
 * parameter, or the missing resource, depending on the failure.
 *
 * @author Promotions Team
 */
@Data
@NoArgsConstructor
public class ErrorResponse {

    private Instant timestamp = Instant.now();
    private Integer status;
    private String error;
    private String message;
    private String path;
    private Map<String, Object> details = new LinkedHashMap<>();

    public ErrorResponse(Integer status, String error, String message, String path) {
        this.status = status;
        this.error = error;
        this.message = message;
        this.path = path;
    }

    /**
     * Add a detail entry; null values are left out of the response.
     */
    public ErrorResponse addDetail(String key, Object value) {
        if (value != null) {
            details.put(key, value);
        }
        return this;
    }
}
