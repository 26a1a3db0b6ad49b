package com.deepansh.agenthost.config;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tracer used for agent spans. Falls back to the global OpenTelemetry instance, which is
 * a no-op unless an SDK or the Java agent registered one; exporters are a deployment concern.
 */
@Configuration
@Slf4j
public class TracingConfig {

    public static final String INSTRUMENTATION_NAME = "agent-host";

    @Bean
    @ConditionalOnMissingBean
    public OpenTelemetry openTelemetry() {
        log.info("Using global OpenTelemetry instance for agent spans");
        return GlobalOpenTelemetry.get();
    }

    @Bean
    public Tracer agentTracer(OpenTelemetry openTelemetry, AgentHostProperties properties) {
        return openTelemetry.getTracer(INSTRUMENTATION_NAME, properties.getSdkVersion());
    }
}
