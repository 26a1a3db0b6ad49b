package com.deepansh.agenthost.context;

import com.deepansh.agenthost.model.AgentConfig;
import com.deepansh.agenthost.model.AgentReference;
import com.deepansh.agenthost.resolver.AgentResolver;
import com.deepansh.agenthost.resolver.RemoteAgent;
import io.opentelemetry.api.trace.Tracer;

import java.util.List;

/**
 * Handler-facing view of the running invocation: who is running, under which run and
 * session, plus access to other agents and deferred work.
 */
public class AgentContext {

    private final ContextScope scope;
    private final AgentConfig agent;
    private final List<AgentConfig> agents;
    private final boolean devmode;
    private final AgentResolver resolver;
    private final BackgroundTasks backgroundTasks;

    public AgentContext(ContextScope scope, AgentConfig agent, List<AgentConfig> agents, boolean devmode,
                        AgentResolver resolver, BackgroundTasks backgroundTasks) {
        this.scope = scope;
        this.agent = agent;
        this.agents = List.copyOf(agents);
        this.devmode = devmode;
        this.resolver = resolver;
        this.backgroundTasks = backgroundTasks;
    }

    public AgentConfig agent() {
        return agent;
    }

    /** Every agent hosted by this process. */
    public List<AgentConfig> agents() {
        return agents;
    }

    public String runId() {
        return scope.getRunId();
    }

    public String sessionId() {
        return scope.getSessionId();
    }

    public String projectId() {
        return scope.getProjectId();
    }

    public String deploymentId() {
        return scope.getDeploymentId();
    }

    public String orgId() {
        return scope.getOrgId();
    }

    public String sdkVersion() {
        return scope.getSdkVersion();
    }

    public boolean devmode() {
        return devmode;
    }

    public AgentLogger logger() {
        return scope.getLogger();
    }

    public Tracer tracer() {
        return scope.getTracer();
    }

    /**
     * Resolves another agent so the handler can call it and keep working with the result.
     * Resolving the running agent itself fails with a loop error.
     */
    public RemoteAgent getAgent(AgentReference ref) {
        return resolver.resolve(ref);
    }

    /** Queues {@code task} to run after this invocation's response has been produced. */
    public void waitUntil(Runnable task) {
        backgroundTasks.add(task);
    }
}
