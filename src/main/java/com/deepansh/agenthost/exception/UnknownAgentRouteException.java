package com.deepansh.agenthost.exception;

public class UnknownAgentRouteException extends AgentException {

    public UnknownAgentRouteException(String path) {
        super("No Agent found at " + path);
    }
}
