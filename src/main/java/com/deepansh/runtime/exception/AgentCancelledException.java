package com.deepansh.runtime.exception;

public class AgentCancelledException extends AgentException {

    public AgentCancelledException() {
        super("Operation cancelled");
    }

    public AgentCancelledException(String message) {
        super(message);
    }
}
