package com.deepansh.agenthost.exception;

/**
 * The control plane declined an invocation, or a loopback call came back non-2xx.
 */
public class RemoteInvocationException extends AgentException {

    public RemoteInvocationException(String message) {
        super(message);
    }

    public RemoteInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
