package com.deepansh.agenthost.router;

import com.deepansh.agenthost.context.AgentContext;
import com.deepansh.agenthost.model.AgentWelcome;
import com.deepansh.agenthost.response.AgentResponseBuilder;
import com.deepansh.agenthost.response.HandlerResult;

import java.util.Optional;

/**
 * User code behind one agent. Register an implementation as a Spring bean and name the
 * bean in the agent's {@code filename}.
 */
@FunctionalInterface
public interface AgentHandler {

    /**
     * @return text, a response built with {@code resp}, or a hand-off; never null
     */
    HandlerResult run(AgentRequest request, AgentResponseBuilder resp, AgentContext context) throws Exception;

    default Optional<AgentWelcome> welcome() {
        return Optional.empty();
    }
}
