package com.deepansh.runtime.memory;

import com.deepansh.runtime.model.Message;
import com.deepansh.runtime.model.ToolCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConversationMemoryTest {

    @Mock ConversationSummarizer summarizer;

    private InMemoryAgentPersistence persistence;

    @BeforeEach
    void setUp() {
        persistence = new InMemoryAgentPersistence();
    }

    @Test
    void addMessage_belowLimit_keepsEverythingVerbatim() {
        ConversationMemory memory = new ConversationMemory(3, 2, summarizer, persistence);

        memory.addMessage(Message.user("hi"));
        memory.addMessage(Message.assistant("hello"));
        memory.addMessage(Message.user("weather?"));

        assertThat(memory.getMessages()).extracting(Message::getContent)
                .containsExactly("hi", "hello", "weather?");
        assertThat(memory.longTermSize()).isZero();
        assertThat(persistence.loadMessages()).hasSize(3);
        verifyNoInteractions(summarizer);
    }

    @Test
    void addMessage_limitPlusOne_summarizesWholeWindow() {
        when(summarizer.summarize(anyList())).thenReturn("User asked about weather twice.");
        ConversationMemory memory = new ConversationMemory(3, 2, summarizer, persistence);

        for (int i = 1; i <= 4; i++) {
            memory.addMessage(Message.user("m" + i));
        }

        verify(summarizer).summarize(argThat(list -> list.size() == 4));
        assertThat(memory.shortTermSize()).isZero();
        assertThat(memory.longTermSize()).isEqualTo(1);
        Message summary = memory.getMessages().get(0);
        assertThat(summary.getRole()).isEqualTo(Message.Role.system);
        assertThat(summary.getContent()).isEqualTo("Historical context: User asked about weather twice.");

        assertThat(persistence.loadMessages())
                .singleElement()
                .satisfies(row -> {
                    assertThat(row.summary()).isTrue();
                    assertThat(row.message().getContent()).startsWith(ConversationMemory.SUMMARY_PREFIX);
                });
    }

    @Test
    void addMessage_summarizerFails_usesFallbackSummary() {
        when(summarizer.summarize(anyList())).thenThrow(new IllegalStateException("Empty summary response"));
        ConversationMemory memory = new ConversationMemory(2, 2, summarizer, persistence);

        memory.addMessage(Message.user("a"));
        memory.addMessage(Message.user("b"));
        memory.addMessage(Message.user("c"));

        assertThat(memory.getMessages()).singleElement()
                .extracting(Message::getContent)
                .isEqualTo("Historical context: Previous conversation context: 3 messages exchanged, "
                        + "focusing on user queries and agent responses.");
    }

    @Test
    void addMessage_longTermOverLimit_evictsOldestSummary() {
        when(summarizer.summarize(anyList())).thenReturn("first", "second");
        ConversationMemory memory = new ConversationMemory(1, 1, summarizer, persistence);

        memory.addMessage(Message.user("a"));
        memory.addMessage(Message.user("b"));
        memory.addMessage(Message.user("c"));
        memory.addMessage(Message.user("d"));

        assertThat(memory.longTermSize()).isEqualTo(1);
        assertThat(memory.getMessages()).extracting(Message::getContent)
                .containsExactly("Historical context: second");
    }

    @Test
    void addMessage_emptyAssistantMessage_isSkipped() {
        ConversationMemory memory = new ConversationMemory(3, 2, summarizer, persistence);

        memory.addMessage(Message.assistant(""));
        memory.addMessage(Message.assistantToolCalls(null,
                List.of(new ToolCall("c1", "echo", "{}"))));

        assertThat(memory.getMessages()).hasSize(1);
        assertThat(memory.getMessages().get(0).hasToolCalls()).isTrue();
        assertThat(persistence.loadMessages()).hasSize(1);
    }

    @Test
    void getMessages_isReadOnly() {
        ConversationMemory memory = new ConversationMemory(3, 2, summarizer, persistence);
        memory.addMessage(Message.user("hi"));

        assertThatThrownBy(() -> memory.getMessages().add(Message.user("x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void init_hydratesTiersAndTrimsToLimits() {
        persistence.saveMessage(Message.system("Historical context: s1"), true);
        persistence.saveMessage(Message.system("Historical context: s2"), true);
        persistence.saveMessage(Message.system("Historical context: s3"), true);
        for (int i = 1; i <= 5; i++) {
            persistence.saveMessage(Message.user("u" + i), false);
        }
        ConversationMemory memory = new ConversationMemory(3, 2, summarizer, persistence);

        memory.init();

        assertThat(memory.getMessages()).extracting(Message::getContent).containsExactly(
                "Historical context: s2", "Historical context: s3", "u3", "u4", "u5");
    }

    @Test
    void clear_emptiesBothTiersAndStore() {
        ConversationMemory memory = new ConversationMemory(3, 2, summarizer, persistence);
        memory.addMessage(Message.user("hi"));

        memory.clear();

        assertThat(memory.getMessages()).isEmpty();
        assertThat(persistence.loadMessages()).isEmpty();
    }

    @Test
    void worksWithoutPersistence() {
        ConversationMemory memory = new ConversationMemory(3, 2, summarizer, null);
        memory.init();
        memory.addMessage(Message.user("hi"));

        assertThat(memory.getMessages()).hasSize(1);
        assertThat(memory.getPersistence()).isNull();
    }

    @Test
    void constructor_nonPositiveLimit_throws() {
        assertThatThrownBy(() -> new ConversationMemory(0, 2, summarizer, persistence))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConversationMemory(2, 0, summarizer, persistence))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
