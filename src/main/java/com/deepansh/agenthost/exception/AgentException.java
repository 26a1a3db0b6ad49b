package com.deepansh.agenthost.exception;

/**
 * Root of the runtime's error taxonomy.
 * Everything below the router rethrows these; the web layer maps them to a 5xx.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
