package com.deepansh.agenthost.response;

import com.deepansh.agenthost.model.AgentReference;
import com.deepansh.agenthost.model.InvocationArguments;

import java.util.Objects;

/**
 * Marker telling the router to finish this invocation by running another agent.
 * A null {@code invocation} forwards the current request unchanged.
 */
public record HandoffResult(AgentReference agent, InvocationArguments invocation) implements HandlerResult {

    public HandoffResult {
        Objects.requireNonNull(agent, "agent");
    }
}
