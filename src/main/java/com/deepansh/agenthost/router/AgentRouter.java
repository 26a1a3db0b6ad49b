package com.deepansh.agenthost.router;

import com.deepansh.agenthost.config.AgentHostProperties;
import com.deepansh.agenthost.context.AgentContext;
import com.deepansh.agenthost.context.AgentLogger;
import com.deepansh.agenthost.context.BackgroundTasks;
import com.deepansh.agenthost.context.ContextScope;
import com.deepansh.agenthost.context.ContextScopes;
import com.deepansh.agenthost.exception.AgentExecutionException;
import com.deepansh.agenthost.exception.HandlerContractException;
import com.deepansh.agenthost.model.AgentConfig;
import com.deepansh.agenthost.model.AgentResponseEnvelope;
import com.deepansh.agenthost.model.InvocationArguments;
import com.deepansh.agenthost.model.InvocationRequest;
import com.deepansh.agenthost.model.WireEncoding;
import com.deepansh.agenthost.resolver.AgentResolver;
import com.deepansh.agenthost.resolver.AgentResolverFactory;
import com.deepansh.agenthost.resolver.RemoteAgent;
import com.deepansh.agenthost.resolver.SessionClient;
import com.deepansh.agenthost.response.AgentResponseBuilder;
import com.deepansh.agenthost.response.AgentResponseData;
import com.deepansh.agenthost.response.EnvelopeCodec;
import com.deepansh.agenthost.response.HandlerResult;
import com.deepansh.agenthost.response.HandoffResult;
import com.deepansh.agenthost.response.TextResult;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Runs one agent's handler for one inbound invocation.
 *
 * Flow:
 *  1. Open an {@code agent.run} span and bind a fresh {@link ContextScope} to the thread
 *  2. Decode the request payload and call the handler
 *  3. Normalize the result: text and built responses become the envelope directly,
 *     a hand-off runs the target agent and its response becomes this one
 *  4. Close the span, then submit any {@code waitUntil} work; once it has all
 *     succeeded the session is reported complete to the control plane
 *
 * Handler failures are recorded on the span and rethrown, checked ones wrapped in
 * {@link AgentExecutionException}.
 */
public class AgentRouter {

    static final String RUN_SPAN = "agent.run";
    static final String REDIRECT_SPAN = "agent.redirect";

    private final AgentConfig agent;
    private final AgentHandler handler;
    private final AgentHostProperties properties;
    private final Tracer tracer;
    private final AgentResolverFactory resolverFactory;
    private final SessionClient sessions;
    private final Executor backgroundExecutor;
    private final AgentLogger baseLogger;

    public AgentRouter(AgentConfig agent, AgentHandler handler, AgentHostProperties properties,
                       Tracer tracer, AgentResolverFactory resolverFactory, SessionClient sessions,
                       Executor backgroundExecutor) {
        this.agent = agent;
        this.handler = handler;
        this.properties = properties;
        this.tracer = tracer;
        this.resolverFactory = resolverFactory;
        this.sessions = sessions;
        this.backgroundExecutor = backgroundExecutor;
        this.baseLogger = AgentLogger.of(AgentRouter.class)
                .child(Map.of("agentId", agent.getId(), "agentName", String.valueOf(agent.getName())));
    }

    public AgentConfig agent() {
        return agent;
    }

    public AgentHandler handler() {
        return handler;
    }

    public AgentResponseEnvelope route(InvocationRequest request, WireEncoding encoding) {
        AgentLogger logger = baseLogger.child(Map.of("runId", request.getRunId()));
        AgentResolver resolver = resolverFactory.forAgent(agent.getId(), logger);
        BackgroundTasks backgroundTasks = new BackgroundTasks();
        String sessionId = ContextScope.sessionIdFor(request.getRunId());

        Span span = tracer.spanBuilder(RUN_SPAN)
                .setAttribute("@agentuity/agentName", agent.getName())
                .setAttribute("@agentuity/agentId", agent.getId())
                .startSpan();
        try (Scope ignored = span.makeCurrent()) {
            ContextScope scope = ContextScope.builder()
                    .span(span)
                    .runId(request.getRunId())
                    .sessionId(sessionId)
                    .projectId(properties.getProjectId())
                    .deploymentId(properties.getDeploymentId())
                    .orgId(properties.getOrgId())
                    .agentId(agent.getId())
                    .logger(logger)
                    .tracer(tracer)
                    .sdkVersion(properties.getSdkVersion())
                    .build();
            AgentContext context = new AgentContext(scope, agent, properties.getAgents(),
                    properties.isDevmode(), resolver, backgroundTasks);

            AgentResponseEnvelope envelope = ContextScopes.callWithin(scope, () -> {
                AgentRequest agentRequest = new AgentRequest(request, EnvelopeCodec.requestData(request, encoding));
                AgentResponseData response = execute(agentRequest, context, scope, resolver);
                // Draining a streamed response happens here, inside the span.
                return EnvelopeCodec.toEnvelope(request.getTrigger().wireName(), response, encoding);
            });
            span.setStatus(StatusCode.OK);
            if (properties.isDevmode()) {
                logger.info("agent returned [contentType={}, metadata={}]",
                        envelope.getContentType(), envelope.getMetadata());
            }
            return envelope;
        } catch (Exception e) {
            logger.error("agent {} failed: {}", agent.getId(), String.valueOf(e.getMessage()));
            throw fail(span, e);
        } finally {
            span.end();
            backgroundTasks.flush(backgroundExecutor, tracer, logger,
                    duration -> sessions.markCompleted(sessionId, duration));
        }
    }

    private AgentResponseData execute(AgentRequest request, AgentContext context,
                                      ContextScope scope, AgentResolver resolver) throws Exception {
        AgentResponseBuilder builder = new AgentResponseBuilder();
        HandlerResult result = handler.run(request, builder, context);
        if (result == null) {
            throw new HandlerContractException("handler returned null instead of a response");
        }
        if (result instanceof TextResult text) {
            return builder.text(text.text());
        }
        if (result instanceof AgentResponseData data) {
            return data;
        }
        return handoff((HandoffResult) result, request, scope, resolver);
    }

    private AgentResponseData handoff(HandoffResult handoff, AgentRequest request,
                                      ContextScope scope, AgentResolver resolver) {
        RemoteAgent target = resolver.resolve(handoff.agent());
        InvocationArguments args = forwardedArguments(handoff.invocation(), request);

        Span span = tracer.spanBuilder(REDIRECT_SPAN)
                .setAttribute("fromAgentId", agent.getId())
                .setAttribute("fromAgentName", agent.getName())
                .setAttribute("toAgentId", target.id())
                .setAttribute("toAgentName", String.valueOf(target.name()))
                .startSpan();
        try (Scope ignored = span.makeCurrent()) {
            ContextScope redirected = scope.derive(target.id(), span,
                    scope.getLogger().child(Map.of("toAgentId", target.id())));
            redirected.getLogger().debug("handing off to {}", target);
            AgentResponseData response = ContextScopes.callWithin(redirected, () -> target.run(args));
            span.setStatus(StatusCode.OK);
            return response;
        } catch (Exception e) {
            throw fail(span, e);
        } finally {
            span.end();
        }
    }

    /**
     * Arguments the target receives: anything the handler left unset is taken from the
     * inbound request.
     */
    static InvocationArguments forwardedArguments(InvocationArguments given, AgentRequest request) {
        if (given == null) {
            return InvocationArguments.builder()
                    .data(request.data())
                    .metadata(request.raw().getMetadata())
                    .build();
        }
        boolean ownData = given.getData() != null;
        return InvocationArguments.builder()
                .data(ownData ? given.getData() : request.data())
                .contentType(ownData ? given.getContentType() : null)
                .metadata(given.getMetadata() != null ? given.getMetadata() : request.raw().getMetadata())
                .build();
    }

    private RuntimeException fail(Span span, Exception e) {
        span.recordException(e);
        span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
        if (e instanceof RuntimeException runtime) {
            return runtime;
        }
        return new AgentExecutionException(agent.getId(), e);
    }
}
