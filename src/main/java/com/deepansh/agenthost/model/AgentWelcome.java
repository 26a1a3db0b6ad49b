package com.deepansh.agenthost.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/** Greeting and sample prompts an agent advertises on {@code GET /welcome}. */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentWelcome {

    String welcome;
    List<Prompt> prompts;

    public record Prompt(String data, String contentType) {
    }
}
