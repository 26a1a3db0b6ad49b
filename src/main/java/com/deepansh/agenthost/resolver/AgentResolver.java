package com.deepansh.agenthost.resolver;

import com.deepansh.agenthost.context.AgentLogger;
import com.deepansh.agenthost.exception.AgentLoopException;
import com.deepansh.agenthost.exception.AgentNotFoundException;
import com.deepansh.agenthost.exception.RemoteInvocationException;
import com.deepansh.agenthost.model.AgentConfig;
import com.deepansh.agenthost.model.AgentReference;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Turns an {@link AgentReference} into an invocable handle for one running agent.
 *
 * Flow:
 *  1. Look for a co-located agent matching the reference (and project, if given)
 *  2. A local match that is the current agent fails as a loop, before any I/O
 *  3. Otherwise ask the control plane to resolve it; a 404 is "not found"
 *  4. A remote resolution back to the current agent is also a loop
 */
public class AgentResolver {

    private final String currentAgentId;
    private final List<AgentConfig> localAgents;
    private final String projectId;
    private final String loopbackBaseUrl;
    private final RestClient loopbackClient;
    private final ControlPlaneClient controlPlane;
    private final CallbackRegistry callbacks;
    private final Duration replyTimeout;
    private final AgentLogger logger;

    AgentResolver(String currentAgentId, List<AgentConfig> localAgents, String projectId,
                  String loopbackBaseUrl, RestClient loopbackClient,
                  ControlPlaneClient controlPlane, CallbackRegistry callbacks,
                  Duration replyTimeout, AgentLogger logger) {
        this.currentAgentId = currentAgentId;
        this.localAgents = List.copyOf(localAgents);
        this.projectId = projectId;
        this.loopbackBaseUrl = loopbackBaseUrl;
        this.loopbackClient = loopbackClient;
        this.controlPlane = controlPlane;
        this.callbacks = callbacks;
        this.replyTimeout = replyTimeout;
        this.logger = logger;
    }

    public String currentAgentId() {
        return currentAgentId;
    }

    public RemoteAgent resolve(AgentReference ref) {
        Optional<AgentConfig> local = findLocal(ref);
        if (local.isPresent()) {
            AgentConfig agent = local.get();
            if (agent.getId().equals(currentAgentId)) {
                throw new AgentLoopException(currentAgentId);
            }
            logger.debug("resolved {} to local agent {}", ref, agent.getId());
            return new LocalAgentInvoker(agent, projectId, loopbackBaseUrl, loopbackClient, logger);
        }
        return resolveRemote(ref);
    }

    private Optional<AgentConfig> findLocal(AgentReference ref) {
        if (ref.projectId() != null && !ref.projectId().equals(projectId)) {
            return Optional.empty();
        }
        return localAgents.stream().filter(ref::matches).findFirst();
    }

    private RemoteAgent resolveRemote(AgentReference ref) {
        ApiResponse response = controlPlane.post("/sdk/agent/resolve", ref);
        if (response.status() == 404) {
            throw ref.hasId() ? AgentNotFoundException.byId(ref.id()) : AgentNotFoundException.byName(ref.name());
        }
        if (!response.flag("success")) {
            throw new RemoteInvocationException(response.message("unknown error from agent response"));
        }
        JsonNode data = response.json().path("data");
        String id = data.path("id").asText(null);
        if (id == null) {
            throw new RemoteInvocationException("agent resolution for " + ref + " returned no id");
        }
        if (id.equals(currentAgentId)) {
            throw new AgentLoopException(currentAgentId);
        }
        logger.debug("resolved {} to remote agent {}", ref, id);
        return new RemoteAgentInvoker(
                id,
                data.path("name").asText(null),
                data.path("projectId").asText(null),
                data.path("description").asText(null),
                controlPlane, callbacks, replyTimeout, logger);
    }
}
