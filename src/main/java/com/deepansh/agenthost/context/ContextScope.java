package com.deepansh.agenthost.context;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything one invocation knows about itself: its span, identifiers, logger and tracer.
 * Built once by the router and never mutated; a hand-off derives a new scope.
 */
@Value
@Builder(toBuilder = true)
public class ContextScope {

    @NonNull Span span;
    @NonNull String runId;
    String sessionId;
    String projectId;
    String deploymentId;
    String orgId;
    @NonNull String agentId;
    @NonNull AgentLogger logger;
    @NonNull Tracer tracer;
    String sdkVersion;

    /** Same identifiers, new agent and span. */
    public ContextScope derive(String targetAgentId, Span targetSpan, AgentLogger targetLogger) {
        return toBuilder()
                .agentId(targetAgentId)
                .span(targetSpan)
                .logger(targetLogger)
                .build();
    }

    public static String sessionIdFor(String runId) {
        return runId.startsWith("sess_") ? runId : "sess_" + runId;
    }
}
