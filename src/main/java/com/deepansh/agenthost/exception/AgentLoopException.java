package com.deepansh.agenthost.exception;

public class AgentLoopException extends AgentException {

    public AgentLoopException(String agentId) {
        super("agent loop detected trying to redirect to the current active agent (" + agentId + ")");
    }
}
