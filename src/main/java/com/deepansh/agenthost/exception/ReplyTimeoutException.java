package com.deepansh.agenthost.exception;

import java.time.Duration;

public class ReplyTimeoutException extends AgentException {

    public ReplyTimeoutException(String agentId, String replyId, Duration waited) {
        super(String.format("no reply from agent %s within %d ms (reply id %s)",
                agentId, waited.toMillis(), replyId));
    }
}
