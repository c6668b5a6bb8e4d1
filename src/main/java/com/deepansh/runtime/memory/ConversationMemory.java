package com.deepansh.runtime.memory;

import com.deepansh.runtime.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Two-tier conversation memory shared by every agent of a coordinator.
 *
 * Short-term holds the most recent messages verbatim. When it grows past its limit
 * the whole window is summarized into one "Historical context" system message that
 * moves to long-term, and short-term starts over. Long-term keeps the newest
 * summaries only.
 *
 * Invariants after every {@link #addMessage(Message)}:
 * short-term size &lt;= short-term limit, long-term size &lt;= long-term limit.
 */
@Slf4j
public class ConversationMemory {

    static final String SUMMARY_PREFIX = "Historical context: ";

    private final int shortTermLimit;
    private final int longTermLimit;
    private final ConversationSummarizer summarizer;
    private final AgentPersistence persistence;

    private final List<Message> shortTerm = new ArrayList<>();
    private final List<Message> longTerm = new ArrayList<>();
    private List<Message> cached;

    public ConversationMemory(int shortTermLimit,
                              int longTermLimit,
                              ConversationSummarizer summarizer,
                              AgentPersistence persistence) {
        if (shortTermLimit < 1 || longTermLimit < 1) {
            throw new IllegalArgumentException("Memory limits must be positive");
        }
        this.shortTermLimit = shortTermLimit;
        this.longTermLimit = longTermLimit;
        this.summarizer = summarizer;
        this.persistence = persistence;
    }

    /** Loads both tiers from the store, trimming each to its limit. */
    public synchronized void init() {
        if (persistence == null) return;

        shortTerm.clear();
        longTerm.clear();
        for (StoredMessage row : persistence.loadMessages()) {
            (row.summary() ? longTerm : shortTerm).add(row.message());
        }
        trimOldest(longTerm, longTermLimit);
        trimOldest(shortTerm, shortTermLimit);
        cached = null;

        log.info("Memory hydrated [longTerm={}, shortTerm={}]", longTerm.size(), shortTerm.size());
    }

    public synchronized void addMessage(Message message) {
        if (!message.isStorable()) {
            log.warn("Skipping empty {} message with no tool calls", message.getRole());
            return;
        }

        shortTerm.add(message);
        cached = null;
        if (persistence != null) {
            persistence.saveMessage(message, false);
        }
        log.debug("Message added [role={}, shortTerm={}]", message.getRole(), shortTerm.size());

        if (shortTerm.size() > shortTermLimit) {
            compact();
        }
    }

    /** Long-term followed by short-term. The returned list is read-only. */
    public synchronized List<Message> getMessages() {
        if (cached == null) {
            List<Message> all = new ArrayList<>(longTerm.size() + shortTerm.size());
            all.addAll(longTerm);
            all.addAll(shortTerm);
            cached = Collections.unmodifiableList(all);
        }
        return cached;
    }

    public synchronized void clear() {
        shortTerm.clear();
        longTerm.clear();
        cached = null;
        if (persistence != null) {
            persistence.clearMessages();
        }
        log.info("Memory cleared");
    }

    public synchronized int shortTermSize() {
        return shortTerm.size();
    }

    public synchronized int longTermSize() {
        return longTerm.size();
    }

    /** The store used for messages, also used by the agent loop for checkpoints. May be null. */
    public AgentPersistence getPersistence() {
        return persistence;
    }

    private void compact() {
        log.info("Short-term memory limit reached, summarizing [shortTerm={}]", shortTerm.size());

        String summary;
        try {
            summary = summarizer.summarize(List.copyOf(shortTerm));
        } catch (RuntimeException e) {
            log.error("Failed to summarize {} messages, using fallback summary", shortTerm.size(), e);
            summary = fallbackSummary(shortTerm.size());
        }

        Message summaryMessage = Message.system(SUMMARY_PREFIX + summary);
        longTerm.add(summaryMessage);
        shortTerm.clear();
        cached = null;

        if (persistence != null) {
            persistence.saveMessage(summaryMessage, true);
            persistence.deleteOldMessages(shortTerm.size());
        }

        if (longTerm.size() > longTermLimit) {
            Message removed = longTerm.remove(0);
            log.info("Pruned oldest long-term entry [removedLength={}, longTerm={}]",
                    removed.getContent().length(), longTerm.size());
        }
        log.info("Summary added to long-term memory [longTerm={}, summaryLength={}]",
                longTerm.size(), summary.length());
    }

    static String fallbackSummary(int count) {
        return "Previous conversation context: " + count
                + " messages exchanged, focusing on user queries and agent responses.";
    }

    private static void trimOldest(List<Message> list, int limit) {
        while (list.size() > limit) {
            list.remove(0);
        }
    }
}
