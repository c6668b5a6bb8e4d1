package com.deepansh.runtime.llm.transport;

import com.deepansh.runtime.exception.LlmApiException;
import com.deepansh.runtime.exception.RateLimitedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Maps non-2xx provider responses onto the runtime's exception types.
 * 429 becomes {@link RateLimitedException}, everything else {@link LlmApiException}.
 */
@Slf4j
public final class HttpErrors {

    private HttpErrors() {
    }

    public static LlmApiException fromResponse(String provider, ClientHttpResponse response) throws IOException {
        int status = response.getStatusCode().value();
        String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
        log.error("{} error response [{}]: {}", provider, status, body);

        if (status == 429) {
            Duration retryAfter = parseRetryAfter(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
            return new RateLimitedException(provider, body, retryAfter);
        }
        return new LlmApiException(provider, status, body);
    }

    /**
     * Retry-After is either delta-seconds or an HTTP date. Returns null when absent or unreadable.
     */
    public static Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) return null;
        String trimmed = value.trim();
        try {
            long seconds = Long.parseLong(trimmed);
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException ignored) {
            // fall through to HTTP-date
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration wait = Duration.between(Instant.now(), at.toInstant());
            return wait.isNegative() ? Duration.ZERO : wait;
        } catch (DateTimeParseException e) {
            log.debug("Unreadable Retry-After header: {}", value);
            return null;
        }
    }
}
