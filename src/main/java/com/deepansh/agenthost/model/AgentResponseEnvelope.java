package com.deepansh.agenthost.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Canonical response of any agent invocation, and the body of a
 * {@code POST /_reply/{replyId}} delivery.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentResponseEnvelope {

    String trigger;
    String payload;
    String contentType;
    Map<String, Object> metadata;
}
