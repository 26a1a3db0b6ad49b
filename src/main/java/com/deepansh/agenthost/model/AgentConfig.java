package com.deepansh.agenthost.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A locally hosted agent. Bound once from configuration.
 * {@code filename} is the name of the Spring bean implementing the agent's handler.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AgentConfig {
    private String id;
    private String name;
    private String description;
    private String filename;
}
