package com.deepansh.agenthost.resolver;

import com.deepansh.agenthost.model.InvocationArguments;
import com.deepansh.agenthost.response.AgentResponseData;

/**
 * Handle to a resolved agent, either co-located or behind the control plane.
 */
public interface RemoteAgent {

    String id();

    String name();

    String projectId();

    String description();

    /**
     * Runs the agent and blocks until its response is available.
     *
     * @param args may be null, in which case the agent receives an empty payload
     */
    AgentResponseData run(InvocationArguments args);
}
