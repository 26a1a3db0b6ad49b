package com.deepansh.agenthost.exception;

public class DataFormatException extends AgentException {

    public DataFormatException(String message) {
        super(message);
    }

    public DataFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
