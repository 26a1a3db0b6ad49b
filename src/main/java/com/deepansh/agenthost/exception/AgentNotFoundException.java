package com.deepansh.agenthost.exception;

public class AgentNotFoundException extends AgentException {

    public AgentNotFoundException(String message) {
        super(message);
    }

    public static AgentNotFoundException byId(String id) {
        return new AgentNotFoundException("agent " + id + " not found or you don't have access to it");
    }

    public static AgentNotFoundException byName(String name) {
        return new AgentNotFoundException("agent named " + name + " not found or you don't have access to it");
    }
}
