package com.deepansh.runtime.exception;

import lombok.Getter;

/**
 * Non-2xx response from a provider. Carries the raw status code and body
 * so callers can inspect provider-specific error payloads.
 * A status code of 0 means the error arrived inside an event stream.
 */
@Getter
public class LlmApiException extends AgentException {

    private final String provider;
    private final int statusCode;
    private final String responseBody;

    public LlmApiException(String provider, int statusCode, String responseBody) {
        this(provider, statusCode, responseBody,
                provider + " API error [" + statusCode + "]: " + abbreviate(responseBody));
    }

    protected LlmApiException(String provider, int statusCode, String responseBody, String message) {
        super(message);
        this.provider = provider;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() > 500 ? body.substring(0, 500) + "..." : body;
    }
}
