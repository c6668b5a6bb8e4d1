package com.deepansh.runtime.exception;

import lombok.Getter;

import java.time.Duration;

/** HTTP 429. {@code retryAfter} is null when the provider sent no Retry-After header. */
@Getter
public class RateLimitedException extends LlmApiException {

    private final Duration retryAfter;

    public RateLimitedException(String provider, String responseBody, Duration retryAfter) {
        super(provider, 429, responseBody, provider + " rate limit exceeded"
                + (retryAfter != null ? " [retry-after=" + retryAfter.toSeconds() + "s]" : ""));
        this.retryAfter = retryAfter;
    }
}
