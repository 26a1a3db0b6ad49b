package com.deepansh.agenthost.resolver;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpHeaders;

/**
 * Result of a control-plane call. {@code json} is only populated for 200/201/202
 * responses with a JSON content type.
 */
public record ApiResponse(int status, JsonNode json, String body, HttpHeaders headers) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public boolean flag(String field) {
        return json != null && json.path(field).asBoolean(false);
    }

    public String message(String fallback) {
        if (json == null || !json.hasNonNull("message")) {
            return fallback;
        }
        return json.get("message").asText();
    }
}
