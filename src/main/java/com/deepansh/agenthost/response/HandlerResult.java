package com.deepansh.agenthost.response;

/**
 * What a handler may return: plain text, an already-built response, or a hand-off.
 */
public sealed interface HandlerResult permits TextResult, AgentResponseData, HandoffResult {

    static HandlerResult text(String text) {
        return new TextResult(text);
    }
}
