package com.deepansh.runtime.resilience;

import com.deepansh.runtime.core.CancellationToken;
import com.deepansh.runtime.exception.AgentCancelledException;
import com.deepansh.runtime.exception.LlmApiException;
import com.deepansh.runtime.exception.LlmTransportException;
import com.deepansh.runtime.exception.RateLimitedException;
import com.deepansh.runtime.llm.LlmProperties;
import io.github.resilience4j.core.functions.Either;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.ResourceAccessException;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Retry policy owned by one provider adapter, built on a resilience4j {@link Retry}.
 *
 * | Failure                 | pass-through | anthropic / gemini |
 * |-------------------------|--------------|--------------------|
 * | 429 rate limit          | retried      | retried            |
 * | 5xx server error        | not retried  | retried            |
 * | connection / read error | retried      | retried            |
 * | other 4xx               | not retried  | not retried        |
 * | cancellation            | never        | never              |
 *
 * Waits grow exponentially from the initial backoff. A 429 carrying Retry-After
 * waits at least that long. The wait itself runs on the turn's cancellation token,
 * so resilience4j only counts attempts and decides what is retryable.
 */
@Slf4j
public class LlmRetryPolicy {

    private final String providerName;
    private final LlmProperties.Retry settings;
    private final Retry retry;

    private LlmRetryPolicy(String providerName, LlmProperties.Retry settings, Retry retry) {
        this.providerName = providerName;
        this.settings = settings;
        this.retry = retry;
    }

    /** Policy for OpenAI-compatible endpoints: rate limits and transport errors only. */
    public static LlmRetryPolicy passThrough(String providerName, LlmProperties.Retry settings) {
        return create(providerName, settings,
                e -> e instanceof RateLimitedException || e instanceof LlmTransportException);
    }

    /** Policy for providers whose 5xx responses are transient: rate limits, server errors, transport errors. */
    public static LlmRetryPolicy withServerErrors(String providerName, LlmProperties.Retry settings) {
        return create(providerName, settings,
                e -> e instanceof RateLimitedException
                        || e instanceof LlmTransportException
                        || (e instanceof LlmApiException api && api.isServerError()));
    }

    private static LlmRetryPolicy create(String providerName,
                                         LlmProperties.Retry settings,
                                         Predicate<Throwable> retryable) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .retryOnException(e -> !(e instanceof AgentCancelledException) && retryable.test(e))
                // no sleep inside resilience4j, execute() waits on the token instead
                .intervalBiFunction((Integer attempt, Either<Throwable, Object> outcome) -> 0L)
                .build();

        Retry retry = Retry.of(providerName + "-llm", config);
        retry.getEventPublisher().onRetry(event -> log.warn(
                "{} call failed, retrying [attempt={}/{}, wait={}ms]: {}",
                providerName,
                event.getNumberOfRetryAttempts(),
                settings.getMaxAttempts(),
                waitMillis(settings, event.getNumberOfRetryAttempts(), event.getLastThrowable()),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "n/a"));
        return new LlmRetryPolicy(providerName, settings, retry);
    }

    static long waitMillis(LlmProperties.Retry settings, int attempt, Throwable failure) {
        long backoff = (long) (settings.getInitialBackoff().toMillis()
                * Math.pow(settings.getMultiplier(), Math.max(0, attempt - 1)));
        if (failure instanceof RateLimitedException rateLimited && rateLimited.getRetryAfter() != null) {
            return Math.max(backoff, rateLimited.getRetryAfter().toMillis());
        }
        return backoff;
    }

    /**
     * Runs one provider call under this policy. The token is checked before every
     * attempt, so a cancelled turn never reaches the transport, and the backoff between
     * attempts ends as soon as the token flips. Transport-level Spring exceptions are
     * normalised to {@link LlmTransportException}.
     */
    public <T> T execute(CancellationToken token, Supplier<T> call) {
        CancellationToken.check(token);
        AtomicInteger attempts = new AtomicInteger();
        AtomicReference<Throwable> lastFailure = new AtomicReference<>();
        return retry.executeSupplier(() -> {
            int attempt = attempts.incrementAndGet();
            if (attempt > 1) {
                CancellationToken.pause(token, waitMillis(settings, attempt - 1, lastFailure.get()));
            }
            CancellationToken.check(token);
            try {
                return call.get();
            } catch (ResourceAccessException e) {
                LlmTransportException failure =
                        new LlmTransportException(providerName + " transport error: " + e.getMessage(), e);
                lastFailure.set(failure);
                throw failure;
            } catch (RuntimeException e) {
                lastFailure.set(e);
                throw e;
            }
        });
    }
}
