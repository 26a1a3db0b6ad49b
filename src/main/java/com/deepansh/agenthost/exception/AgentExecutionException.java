package com.deepansh.agenthost.exception;

/**
 * Wraps a checked exception thrown from inside a user handler.
 */
public class AgentExecutionException extends AgentException {

    public AgentExecutionException(String agentId, Throwable cause) {
        super("agent " + agentId + " failed: " + cause.getMessage(), cause);
    }
}
