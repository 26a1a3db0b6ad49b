package com.deepansh.agenthost.model;

import com.deepansh.agenthost.exception.HandlerContractException;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Points at an agent either by id, or by name within a project.
 * When both id and name are present the id wins.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentReference(String id, String name, String projectId) {

    public AgentReference {
        boolean hasId = id != null && !id.isBlank();
        boolean hasName = name != null && !name.isBlank();
        if (!hasId && !hasName) {
            throw new HandlerContractException("agent reference must carry an id or a name");
        }
    }

    public static AgentReference byId(String id) {
        return new AgentReference(id, null, null);
    }

    public static AgentReference byName(String name) {
        return new AgentReference(null, name, null);
    }

    public static AgentReference byName(String name, String projectId) {
        return new AgentReference(null, name, projectId);
    }

    public boolean hasId() {
        return id != null && !id.isBlank();
    }

    /** True when this reference selects the given local agent. */
    public boolean matches(AgentConfig agent) {
        if (hasId()) {
            return id.equals(agent.getId());
        }
        return name.equals(agent.getName());
    }

    @Override
    public String toString() {
        return hasId() ? "id=" + id : "name=" + name;
    }
}
