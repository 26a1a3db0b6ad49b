package com.deepansh.agenthost.response;

import com.deepansh.agenthost.data.Data;

import java.util.Map;
import java.util.Objects;

/**
 * A payload plus optional metadata. This is both a handler result and the result of
 * invoking another agent, local or remote.
 */
public record AgentResponseData(Data data, Map<String, Object> metadata) implements HandlerResult {

    public AgentResponseData {
        Objects.requireNonNull(data, "data");
    }

    public AgentResponseData(Data data) {
        this(data, null);
    }
}
