package com.deepansh.agenthost.config;

import com.deepansh.agenthost.model.AgentConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Strongly-typed configuration for the agent host.
 * Bound from application.yml under the "agenthost" prefix.
 */
@ConfigurationProperties(prefix = "agenthost")
@Data
public class AgentHostProperties {

    private String projectId;
    private String orgId;
    private String deploymentId;
    private String sdkVersion = "0.1.0";
    private boolean devmode;

    /** Locally hosted agents. Loaded once at startup. */
    private List<AgentConfig> agents = new ArrayList<>();

    private ControlPlane controlPlane = new ControlPlane();
    private Remote remote = new Remote();
    private Loopback loopback = new Loopback();

    @Data
    public static class ControlPlane {
        private String baseUrl = "https://agentuity.ai/";
        private String apiKey = "";
        private int timeoutMs = 20_000;
        /** Attempts for a throttled (429) call, including the first. */
        private int maxAttempts = 3;
        private long backoffMs = 500;

        public Duration getTimeout() {
            return Duration.ofMillis(timeoutMs);
        }
    }

    @Data
    public static class Remote {
        /** Upper bound on waiting for a remote agent's reply. */
        private long replyTimeoutMs = 300_000;

        public Duration getReplyTimeout() {
            return Duration.ofMillis(replyTimeoutMs);
        }
    }

    @Data
    public static class Loopback {
        private String host = "127.0.0.1";
        private int maxConnections = 50;
    }
}
