package com.deepansh.runtime.exception;

/** Connection-level failure talking to a provider: refused, reset, DNS, read timeout. */
public class LlmTransportException extends AgentException {

    public LlmTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
