package com.deepansh.runtime.core;

import com.deepansh.runtime.llm.LlmClient;
import com.deepansh.runtime.memory.ConversationMemory;
import com.deepansh.runtime.memory.ConversationSummarizer;
import com.deepansh.runtime.model.AgentResponse;
import com.deepansh.runtime.model.LlmChunk;
import com.deepansh.runtime.model.LlmResponse;
import com.deepansh.runtime.model.Message;
import com.deepansh.runtime.model.ToolCall;
import com.deepansh.runtime.observability.LogRedactor;
import com.deepansh.runtime.tool.ToolArgumentParser;
import com.deepansh.runtime.tool.ToolDefinition;
import com.deepansh.runtime.tool.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentCoordinatorTest {

    private static final String TRANSFER_TO_SPECIALIST =
            "{\"target_agent\":\"api_specialist\",\"reason\":\"needs an API call\"}";

    @Mock LlmClient llmClient;
    @Mock ConversationSummarizer summarizer;

    private ThreadPoolTaskExecutor executor;
    private ConversationMemory memory;
    private AgentCoordinator coordinator;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.initialize();
        memory = new ConversationMemory(50, 5, summarizer, null);
        coordinator = new AgentCoordinator(List.of(agent("assistant"), agent("api_specialist")));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private AgentLoop agent(String name) {
        return AgentLoop.builder()
                .name(name)
                .instructions("You are " + name + ".")
                .llmClient(llmClient)
                .memory(memory)
                .toolRegistry(new ToolRegistry(List.of(), new ToolArgumentParser(new ObjectMapper()),
                        executor, new LogRedactor()))
                .build();
    }

    private static LlmResponse transferCall(String args) {
        return LlmResponse.builder()
                .toolCalls(List.of(new ToolCall("t1", TransferToAgentTool.NAME, args)))
                .finishReason("tool_calls")
                .build();
    }

    private static LlmResponse answer(String text) {
        return LlmResponse.builder().content(text).finishReason("stop").build();
    }

    @Test
    void constructor_noAgents_throws() {
        assertThatThrownBy(() -> new AgentCoordinator(List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("AgentCoordinator requires at least one agent");
    }

    @Test
    void constructor_firstAgentActiveAndEveryAgentCanTransfer() {
        assertThat(coordinator.getActiveAgent().getName()).isEqualTo("assistant");
        assertThat(coordinator.agentNames()).containsExactly("assistant", "api_specialist");

        ToolDefinition transfer = coordinator.getActiveAgent().getToolRegistry().getAllDefinitions().stream()
                .filter(d -> d.getName().equals(TransferToAgentTool.NAME))
                .findFirst().orElseThrow();
        @SuppressWarnings("unchecked")
        Map<String, Object> properties = (Map<String, Object>) transfer.getInputSchema().get("properties");
        assertThat(properties.get("target_agent").toString()).contains("assistant", "api_specialist");
    }

    @Test
    void run_transferRequested_switchesAfterTheTurnEnds() {
        when(llmClient.chat(anyList(), anyList(), any(), any()))
                .thenReturn(transferCall(TRANSFER_TO_SPECIALIST), answer("Handing over to the API specialist."));

        AgentResponse response = coordinator.run("call the weather API", null);

        assertThat(response.getAgentName()).isEqualTo("assistant");
        assertThat(coordinator.getActiveAgent().getName()).isEqualTo("api_specialist");
        assertThat(memory.getMessages()).anySatisfy(m ->
                assertThat(m.getContent()).startsWith("SUCCESS. You have transferred control to api_specialist"));
    }

    @Test
    void run_unknownTarget_reportsErrorAndKeepsActiveAgent() {
        when(llmClient.chat(anyList(), anyList(), any(), any()))
                .thenReturn(transferCall("{\"target_agent\":\"ghost\",\"reason\":\"?\"}"), answer("Staying here."));

        coordinator.run("hi", null);

        assertThat(coordinator.getActiveAgent().getName()).isEqualTo("assistant");
        Message observation = memory.getMessages().stream()
                .filter(m -> m.getRole() == Message.Role.tool)
                .findFirst().orElseThrow();
        assertThat(observation.getContent())
                .isEqualTo("Error: Agent \"ghost\" not found. Available agents: assistant, api_specialist");
    }

    @Test
    void run_failedTurn_stillAppliesTransfer() {
        when(llmClient.chat(anyList(), anyList(), any(), any()))
                .thenReturn(transferCall(TRANSFER_TO_SPECIALIST))
                .thenThrow(new IllegalStateException("provider down"));

        assertThatThrownBy(() -> coordinator.run("hi", null)).isInstanceOf(IllegalStateException.class);

        assertThat(coordinator.getActiveAgent().getName()).isEqualTo("api_specialist");
    }

    @Test
    void runStreaming_transferAppliedOnceStreamIsExhausted() {
        when(llmClient.streamChat(anyList(), anyList(), any(), any())).thenReturn(
                Stream.of(LlmChunk.toolCalls(List.of(new ToolCall("t1", TransferToAgentTool.NAME, TRANSFER_TO_SPECIALIST)))),
                Stream.of(LlmChunk.text("Done.")));

        try (Stream<AgentResponse> stream = coordinator.runStreaming("hi", null)) {
            Iterable<AgentResponse> events = stream::iterator;
            for (AgentResponse event : events) {
                if (!event.isFinal()) {
                    assertThat(coordinator.getActiveAgent().getName()).isEqualTo("assistant");
                }
            }
        }

        assertThat(coordinator.getActiveAgent().getName()).isEqualTo("api_specialist");
    }

    @Test
    void nextTurn_goesToNewActiveAgent() {
        when(llmClient.chat(anyList(), anyList(), any(), any()))
                .thenReturn(transferCall(TRANSFER_TO_SPECIALIST), answer("Over to you."), answer("Specialist here."));

        coordinator.run("need API", null);
        AgentResponse second = coordinator.run("GET https://api.example.com", null);

        assertThat(second.getAgentName()).isEqualTo("api_specialist");
        assertThat(second.getText()).isEqualTo("Specialist here.");
    }
}
