package com.deepansh.agenthost.router;

import com.deepansh.agenthost.data.Data;
import com.deepansh.agenthost.model.InvocationRequest;
import com.deepansh.agenthost.model.Trigger;

import java.util.Collections;
import java.util.Map;

/** Read-only view of the inbound invocation handed to a handler. */
public class AgentRequest {

    private final InvocationRequest request;
    private final Data data;

    public AgentRequest(InvocationRequest request, Data data) {
        this.request = request;
        this.data = data;
    }

    public Trigger trigger() {
        return request.getTrigger();
    }

    public Data data() {
        return data;
    }

    public String runId() {
        return request.getRunId();
    }

    public Map<String, Object> metadata() {
        Map<String, Object> metadata = request.getMetadata();
        return metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(metadata);
    }

    public Object get(String key, Object defaultValue) {
        return metadata().getOrDefault(key, defaultValue);
    }

    InvocationRequest raw() {
        return request;
    }
}
