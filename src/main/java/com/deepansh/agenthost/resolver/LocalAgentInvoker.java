package com.deepansh.agenthost.resolver;

import com.deepansh.agenthost.context.AgentLogger;
import com.deepansh.agenthost.context.TraceHeaders;
import com.deepansh.agenthost.exception.RemoteInvocationException;
import com.deepansh.agenthost.model.AgentConfig;
import com.deepansh.agenthost.model.AgentResponseEnvelope;
import com.deepansh.agenthost.model.InvocationArguments;
import com.deepansh.agenthost.model.InvocationRequest;
import com.deepansh.agenthost.model.Trigger;
import com.deepansh.agenthost.model.WireEncoding;
import com.deepansh.agenthost.response.AgentResponseData;
import com.deepansh.agenthost.response.EnvelopeCodec;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Calls an agent hosted by this process through its own HTTP endpoint, so the target
 * gets a fresh invocation with its own scope and span.
 */
class LocalAgentInvoker implements RemoteAgent {

    private final AgentConfig agent;
    private final String projectId;
    private final String baseUrl;
    private final RestClient restClient;
    private final AgentLogger logger;

    LocalAgentInvoker(AgentConfig agent, String projectId, String baseUrl,
                      RestClient restClient, AgentLogger logger) {
        this.agent = agent;
        this.projectId = projectId;
        this.baseUrl = baseUrl;
        this.restClient = restClient;
        this.logger = logger;
    }

    @Override
    public String id() {
        return agent.getId();
    }

    @Override
    public String name() {
        return agent.getName();
    }

    @Override
    public String projectId() {
        return projectId;
    }

    @Override
    public String description() {
        return agent.getDescription();
    }

    @Override
    public AgentResponseData run(InvocationArguments args) {
        InvocationRequest request = InvocationPayloads.toRequest(Trigger.AGENT, args);
        Map<String, String> traceHeaders = TraceHeaders.inject(new HashMap<>());
        String url = baseUrl + "/" + agent.getId();
        logger.debug("invoking local agent {} at {}", agent.getId(), url);

        return restClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .headers(h -> traceHeaders.forEach(h::set))
                .body(request)
                .exchange((req, response) -> {
                    if (!response.getStatusCode().is2xxSuccessful()) {
                        String body = new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        throw new RemoteInvocationException("error invoking agent " + agent.getId()
                                + " (" + response.getStatusCode().value() + "): " + body);
                    }
                    AgentResponseEnvelope envelope = response.bodyTo(AgentResponseEnvelope.class);
                    if (envelope == null) {
                        throw new RemoteInvocationException("agent " + agent.getId() + " returned an empty response");
                    }
                    return EnvelopeCodec.fromEnvelope(envelope, WireEncoding.BASE64);
                });
    }

    @Override
    public String toString() {
        return "LocalAgent[" + agent.getId() + "]";
    }
}
