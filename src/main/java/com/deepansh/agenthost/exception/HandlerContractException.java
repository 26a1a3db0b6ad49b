package com.deepansh.agenthost.exception;

/**
 * A caller broke the handler contract: null result, non-JSON metadata,
 * malformed agent reference. Raised before any I/O and never retried.
 */
public class HandlerContractException extends AgentException {

    public HandlerContractException(String message) {
        super(message);
    }
}
