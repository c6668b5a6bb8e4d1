package com.deepansh.runtime.memory;

import com.deepansh.runtime.model.AgentCheckpoint;
import com.deepansh.runtime.model.Message;
import com.deepansh.runtime.model.ToolCall;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JpaAgentPersistenceTest {

    @Mock ChatMessageRepository messageRepository;
    @Mock CheckpointRepository checkpointRepository;

    private JpaAgentPersistence persistence;

    @BeforeEach
    void setUp() {
        persistence = new JpaAgentPersistence(messageRepository, checkpointRepository, new ObjectMapper());
    }

    @Test
    void saveMessage_toolCallsStoredAsJson() {
        persistence.saveMessage(Message.assistantToolCalls(null,
                List.of(new ToolCall("call_1", "echo", "{\"text\":\"hi\"}"))), false);

        ArgumentCaptor<ChatMessageEntity> captor = ArgumentCaptor.forClass(ChatMessageEntity.class);
        verify(messageRepository).save(captor.capture());
        ChatMessageEntity saved = captor.getValue();
        assertThat(saved.getRole()).isEqualTo(Message.Role.assistant);
        assertThat(saved.isSummary()).isFalse();
        assertThat(saved.getToolCallsJson()).contains("\"id\":\"call_1\"").contains("\"toolName\":\"echo\"");
    }

    @Test
    void loadMessages_restoresToolCallsAndSummaryFlag() {
        Instant created = Instant.parse("2026-01-01T00:00:00Z");
        when(messageRepository.findAllByOrderByIdAsc()).thenReturn(List.of(
                ChatMessageEntity.builder().id(1L).role(Message.Role.system)
                        .content("Historical context: x").summary(true).createdAt(created).build(),
                ChatMessageEntity.builder().id(2L).role(Message.Role.assistant)
                        .toolCallsJson("[{\"id\":\"c1\",\"toolName\":\"echo\",\"arguments\":\"{}\"}]").build(),
                ChatMessageEntity.builder().id(3L).role(Message.Role.tool)
                        .toolCallId("c1").toolName("echo").content("hi").build()));

        List<StoredMessage> rows = persistence.loadMessages();

        assertThat(rows).hasSize(3);
        assertThat(rows.get(0).summary()).isTrue();
        assertThat(rows.get(0).createdAt()).isEqualTo(created);
        assertThat(rows.get(1).message().getToolCalls()).singleElement()
                .extracting(ToolCall::getToolName).isEqualTo("echo");
        assertThat(rows.get(2).message().getName()).isEqualTo("echo");
        assertThat(rows.get(2).message().getToolCallId()).isEqualTo("c1");
    }

    @Test
    void loadMessages_unreadableToolCalls_areDropped() {
        when(messageRepository.findAllByOrderByIdAsc()).thenReturn(List.of(
                ChatMessageEntity.builder().id(7L).role(Message.Role.assistant)
                        .content("partial").toolCallsJson("not json").build()));

        assertThat(persistence.loadMessages()).singleElement()
                .satisfies(row -> assertThat(row.message().getToolCalls()).isNull());
    }

    @Test
    void deleteOldMessages_deletesEverythingPastKeepLimit() {
        ChatMessageEntity newest = ChatMessageEntity.builder().id(3L).build();
        ChatMessageEntity middle = ChatMessageEntity.builder().id(2L).build();
        ChatMessageEntity oldest = ChatMessageEntity.builder().id(1L).build();
        when(messageRepository.findBySummaryFalseOrderByIdDesc()).thenReturn(List.of(newest, middle, oldest));

        persistence.deleteOldMessages(1);

        verify(messageRepository).deleteAll(List.of(middle, oldest));
    }

    @Test
    void deleteOldMessages_nothingToPrune_doesNotDelete() {
        when(messageRepository.findBySummaryFalseOrderByIdDesc())
                .thenReturn(List.of(ChatMessageEntity.builder().id(1L).build()));

        persistence.deleteOldMessages(5);

        verify(messageRepository, never()).deleteAll(any());
    }

    @Test
    void saveCheckpoint_alwaysUsesSingletonRow() {
        persistence.saveCheckpoint(AgentCheckpoint.builder()
                .running(true).currentStep("Sending request").iterationCount(3).build());

        ArgumentCaptor<CheckpointEntity> captor = ArgumentCaptor.forClass(CheckpointEntity.class);
        verify(checkpointRepository).save(captor.capture());
        assertThat(captor.getValue().getId()).isEqualTo(CheckpointEntity.SINGLETON_ID);
        assertThat(captor.getValue().getIterationCount()).isEqualTo(3);
    }

    @Test
    void loadCheckpoint_mapsEntity() {
        when(checkpointRepository.findById(CheckpointEntity.SINGLETON_ID)).thenReturn(Optional.of(
                CheckpointEntity.builder().id(1L).running(false).currentStep("Run failed")
                        .iterationCount(4).errorMessage("boom").build()));

        assertThat(persistence.loadCheckpoint()).get().satisfies(cp -> {
            assertThat(cp.isRunning()).isFalse();
            assertThat(cp.getIterationCount()).isEqualTo(4);
            assertThat(cp.getErrorMessage()).isEqualTo("boom");
        });
    }

    @Test
    void clearCheckpoint_missingRow_isNoOp() {
        when(checkpointRepository.existsById(CheckpointEntity.SINGLETON_ID)).thenReturn(false);

        persistence.clearCheckpoint();

        verify(checkpointRepository, never()).deleteById(any());
    }
}
