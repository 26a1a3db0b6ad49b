package com.deepansh.agenthost.handlers;

import com.deepansh.agenthost.context.AgentContext;
import com.deepansh.agenthost.model.AgentWelcome;
import com.deepansh.agenthost.response.AgentResponseBuilder;
import com.deepansh.agenthost.response.HandlerResult;
import com.deepansh.agenthost.router.AgentHandler;
import com.deepansh.agenthost.router.AgentRequest;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sample agent: returns the request payload with its content type, tagged with the trigger.
 */
@Component("echo")
public class EchoAgent implements AgentHandler {

    @Override
    public HandlerResult run(AgentRequest request, AgentResponseBuilder resp, AgentContext context) {
        context.logger().info("echoing {} request", request.trigger());
        return resp.data(request.data(), request.data().contentType(),
                Map.of("trigger", request.trigger().wireName()));
    }

    @Override
    public Optional<AgentWelcome> welcome() {
        return Optional.of(AgentWelcome.builder()
                .welcome("Send me anything and I will send it back.")
                .prompts(List.of(new AgentWelcome.Prompt("Hello, world!", "text/plain")))
                .build());
    }
}
