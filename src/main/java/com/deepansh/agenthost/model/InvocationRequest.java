package com.deepansh.agenthost.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * One inbound invocation as delivered to {@code POST /{agentId}}.
 *
 * {@code payload} is normally a string (base64, or UTF-8 for plain-text clients);
 * a JSON object or array is accepted as-is and treated as JSON bytes.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InvocationRequest {

    @NotNull(message = "trigger must be set")
    Trigger trigger;

    String contentType;

    JsonNode payload;

    Map<String, Object> metadata;

    @NotBlank(message = "runId must not be blank")
    String runId;
}
