package com.deepansh.runtime.core;

import com.deepansh.runtime.exception.AgentCancelledException;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation flag shared between a caller and every blocking step of one turn.
 * Once cancelled it stays cancelled.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new AgentCancelledException();
        }
    }

    /**
     * Blocks for up to {@code millis}, returning early when the token is cancelled.
     *
     * @return true if the token was cancelled while (or before) waiting
     */
    public boolean await(long millis) throws InterruptedException {
        return cancelled.await(millis, TimeUnit.MILLISECONDS);
    }

    /** Null-safe check for the many call sites where a token is optional. */
    public static void check(CancellationToken token) {
        if (token != null) {
            token.throwIfCancelled();
        }
    }

    /** Sleeps for {@code millis} unless the token is cancelled first, then throws. */
    public static void pause(CancellationToken token, long millis) {
        if (millis <= 0) {
            check(token);
            return;
        }
        try {
            if (token == null) {
                Thread.sleep(millis);
            } else if (token.await(millis)) {
                throw new AgentCancelledException();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentCancelledException();
        }
    }
}
