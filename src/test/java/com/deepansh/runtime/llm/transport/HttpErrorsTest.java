package com.deepansh.runtime.llm.transport;

import com.deepansh.runtime.exception.LlmApiException;
import com.deepansh.runtime.exception.RateLimitedException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.client.MockClientHttpResponse;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

import static org.assertj.core.api.Assertions.assertThat;

class HttpErrorsTest {

    @Test
    void fromResponse_429_carriesRetryAfter() throws Exception {
        MockClientHttpResponse response = new MockClientHttpResponse(
                "{\"error\":\"rate\"}".getBytes(StandardCharsets.UTF_8), HttpStatus.TOO_MANY_REQUESTS);
        response.getHeaders().add("Retry-After", "7");

        LlmApiException error = HttpErrors.fromResponse("openai", response);

        assertThat(error).isInstanceOf(RateLimitedException.class);
        assertThat(((RateLimitedException) error).getRetryAfter()).isEqualTo(Duration.ofSeconds(7));
        assertThat(error.getStatusCode()).isEqualTo(429);
    }

    @Test
    void fromResponse_otherStatus_keepsStatusAndBody() throws Exception {
        MockClientHttpResponse response = new MockClientHttpResponse(
                "bad request".getBytes(StandardCharsets.UTF_8), HttpStatus.BAD_REQUEST);

        LlmApiException error = HttpErrors.fromResponse("anthropic", response);

        assertThat(error).isNotInstanceOf(RateLimitedException.class);
        assertThat(error.getStatusCode()).isEqualTo(400);
        assertThat(error.getResponseBody()).isEqualTo("bad request");
        assertThat(error.isServerError()).isFalse();
    }

    @Test
    void parseRetryAfter_seconds() {
        assertThat(HttpErrors.parseRetryAfter("120")).isEqualTo(Duration.ofSeconds(120));
        assertThat(HttpErrors.parseRetryAfter(" 0 ")).isEqualTo(Duration.ZERO);
    }

    @Test
    void parseRetryAfter_httpDate() {
        String future = DateTimeFormatter.RFC_1123_DATE_TIME.format(ZonedDateTime.now(ZoneOffset.UTC).plusSeconds(60));
        String past = DateTimeFormatter.RFC_1123_DATE_TIME.format(ZonedDateTime.now(ZoneOffset.UTC).minusSeconds(60));

        assertThat(HttpErrors.parseRetryAfter(future)).isBetween(Duration.ofSeconds(50), Duration.ofSeconds(60));
        assertThat(HttpErrors.parseRetryAfter(past)).isEqualTo(Duration.ZERO);
    }

    @Test
    void parseRetryAfter_absentOrUnreadable_isNull() {
        assertThat(HttpErrors.parseRetryAfter(null)).isNull();
        assertThat(HttpErrors.parseRetryAfter("")).isNull();
        assertThat(HttpErrors.parseRetryAfter("-5")).isNull();
        assertThat(HttpErrors.parseRetryAfter("soon")).isNull();
    }
}
