package com.deepansh.runtime.memory;

import com.deepansh.runtime.model.Message;

import java.time.Instant;

/**
 * One persisted message row together with its summary flag.
 */
public record StoredMessage(Long id, Message message, boolean summary, Instant createdAt) {
}
