package com.deepansh.agenthost;

import com.deepansh.agenthost.config.AgentHostProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AgentHostProperties.class)
public class AgentHostApplication {
    public static void main(String[] args) {
        SpringApplication.run(AgentHostApplication.class, args);
    }
}
