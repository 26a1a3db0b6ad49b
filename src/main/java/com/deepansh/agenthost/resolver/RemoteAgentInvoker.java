package com.deepansh.agenthost.resolver;

import com.deepansh.agenthost.context.AgentLogger;
import com.deepansh.agenthost.exception.AgentException;
import com.deepansh.agenthost.exception.RemoteInvocationException;
import com.deepansh.agenthost.exception.ReplyTimeoutException;
import com.deepansh.agenthost.model.InvocationArguments;
import com.deepansh.agenthost.model.InvocationRequest;
import com.deepansh.agenthost.model.Trigger;
import com.deepansh.agenthost.response.AgentResponseData;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an agent through the control plane and waits for its reply on the
 * {@code /_reply/{replyId}} side channel.
 *
 * The reply id is registered before the run request is sent, so a reply that
 * arrives before the acknowledgement still finds its waiter.
 */
class RemoteAgentInvoker implements RemoteAgent {

    private final String id;
    private final String name;
    private final String projectId;
    private final String description;
    private final ControlPlaneClient client;
    private final CallbackRegistry callbacks;
    private final Duration replyTimeout;
    private final AgentLogger logger;

    RemoteAgentInvoker(String id, String name, String projectId, String description,
                       ControlPlaneClient client, CallbackRegistry callbacks,
                       Duration replyTimeout, AgentLogger logger) {
        this.id = id;
        this.name = name;
        this.projectId = projectId;
        this.description = description;
        this.client = client;
        this.callbacks = callbacks;
        this.replyTimeout = replyTimeout;
        this.logger = logger;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String projectId() {
        return projectId;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public AgentResponseData run(InvocationArguments args) {
        String replyId = UUID.randomUUID().toString();
        InvocationRequest request = InvocationPayloads.toRequest(Trigger.AGENT, args);
        CompletableFuture<AgentResponseData> reply = callbacks.register(replyId);

        ApiResponse ack;
        try {
            ack = client.post("/sdk/agent/" + id + "/run/" + replyId, request);
        } catch (RuntimeException e) {
            callbacks.cancel(replyId);
            throw e;
        }
        if (!ack.isSuccess() || !ack.flag("success")) {
            callbacks.cancel(replyId);
            throw new RemoteInvocationException(ack.message("unknown error from agent response"));
        }

        logger.debug("waiting for remote agent {} reply {}", id, replyId);
        try {
            AgentResponseData response = reply.get(replyTimeout.toMillis(), TimeUnit.MILLISECONDS);
            logger.debug("received remote agent {} reply {}", id, replyId);
            return response;
        } catch (TimeoutException e) {
            callbacks.cancel(replyId);
            throw new ReplyTimeoutException(id, replyId, replyTimeout);
        } catch (InterruptedException e) {
            callbacks.cancel(replyId);
            Thread.currentThread().interrupt();
            throw new AgentException("interrupted waiting for agent " + id, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new RemoteInvocationException("agent " + id + " failed", cause);
        }
    }

    @Override
    public String toString() {
        return "RemoteAgent[" + id + "]";
    }
}
