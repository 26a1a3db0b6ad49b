package com.deepansh.agenthost.resolver;

import com.deepansh.agenthost.config.AgentHostProperties;
import com.deepansh.agenthost.context.AgentLogger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Creates one {@link AgentResolver} per invocation, bound to the agent that is running.
 */
@Component
public class AgentResolverFactory {

    static final int DEFAULT_PORT = 3500;

    private final AgentHostProperties properties;
    private final ControlPlaneClient controlPlane;
    private final CallbackRegistry callbacks;
    private final RestClient loopbackClient;
    private final Environment environment;

    public AgentResolverFactory(AgentHostProperties properties,
                                ControlPlaneClient controlPlane,
                                CallbackRegistry callbacks,
                                @Qualifier("loopbackRestClientBuilder") RestClient.Builder loopbackBuilder,
                                Environment environment) {
        this.properties = properties;
        this.controlPlane = controlPlane;
        this.callbacks = callbacks;
        this.loopbackClient = loopbackBuilder.clone().build();
        this.environment = environment;
    }

    public AgentResolver forAgent(String currentAgentId, AgentLogger logger) {
        return new AgentResolver(
                currentAgentId,
                properties.getAgents(),
                properties.getProjectId(),
                loopbackBaseUrl(),
                loopbackClient,
                controlPlane,
                callbacks,
                properties.getRemote().getReplyTimeout(),
                logger);
    }

    // The bound port is only known once the web server has started.
    private String loopbackBaseUrl() {
        Integer port = environment.getProperty("local.server.port", Integer.class);
        if (port == null) {
            port = environment.getProperty("server.port", Integer.class, DEFAULT_PORT);
        }
        return "http://" + properties.getLoopback().getHost() + ":" + port;
    }
}
