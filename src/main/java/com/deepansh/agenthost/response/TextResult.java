package com.deepansh.agenthost.response;

import java.util.Objects;

public record TextResult(String text) implements HandlerResult {

    public TextResult {
        Objects.requireNonNull(text, "text");
    }
}
