package com.deepansh.agenthost.router;

import com.deepansh.agenthost.config.AgentHostProperties;
import com.deepansh.agenthost.model.AgentConfig;
import com.deepansh.agenthost.resolver.AgentResolverFactory;
import com.deepansh.agenthost.resolver.SessionClient;
import io.opentelemetry.api.trace.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * One {@link AgentRouter} per configured agent, keyed by agent id.
 *
 * Handlers are Spring beans of type {@link AgentHandler}; each configured agent names
 * its bean in {@code filename}. A missing bean or an empty agent list fails startup.
 */
@Component
@Slf4j
public class AgentRegistry {

    private final Map<String, AgentRouter> routers = new LinkedHashMap<>();

    public AgentRegistry(AgentHostProperties properties,
                         Map<String, AgentHandler> handlers,
                         Tracer agentTracer,
                         AgentResolverFactory resolverFactory,
                         SessionClient sessions,
                         @Qualifier("backgroundTaskExecutor") Executor backgroundExecutor) {
        if (properties.getAgents().isEmpty()) {
            throw new IllegalStateException("No routes found: configure at least one agent under agenthost.agents");
        }
        for (AgentConfig agent : properties.getAgents()) {
            AgentHandler handler = handlers.get(agent.getFilename());
            if (handler == null) {
                throw new IllegalStateException(String.format(
                        "Handler bean '%s' does not exist for agent %s (%s)",
                        agent.getFilename(), agent.getName(), agent.getId()));
            }
            routers.put(agent.getId(),
                    new AgentRouter(agent, handler, properties, agentTracer, resolverFactory, sessions,
                            backgroundExecutor));
            log.info("Registered agent: [{}] {} -> {}", agent.getId(), agent.getName(), agent.getFilename());
        }
        log.info("Total agents registered: {}", routers.size());
    }

    public Optional<AgentRouter> find(String agentId) {
        return Optional.ofNullable(routers.get(agentId));
    }

    public Collection<AgentRouter> routes() {
        return Collections.unmodifiableCollection(routers.values());
    }
}
