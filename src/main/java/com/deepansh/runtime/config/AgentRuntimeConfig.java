package com.deepansh.runtime.config;

import com.deepansh.runtime.core.AgentCoordinator;
import com.deepansh.runtime.core.AgentLoop;
import com.deepansh.runtime.llm.LlmClient;
import com.deepansh.runtime.memory.AgentPersistence;
import com.deepansh.runtime.memory.ChatMessageRepository;
import com.deepansh.runtime.memory.CheckpointRepository;
import com.deepansh.runtime.memory.ConversationMemory;
import com.deepansh.runtime.memory.ConversationSummarizer;
import com.deepansh.runtime.memory.InMemoryAgentPersistence;
import com.deepansh.runtime.memory.JpaAgentPersistence;
import com.deepansh.runtime.observability.LogRedactor;
import com.deepansh.runtime.observability.RunStateTracker;
import com.deepansh.runtime.tool.AgentTool;
import com.deepansh.runtime.tool.ToolArgumentParser;
import com.deepansh.runtime.tool.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;

import java.util.ArrayList;
import java.util.List;

/**
 * Wires memory, persistence, tool registries and the agents of the coordinator.
 */
@Configuration
@Slf4j
public class AgentRuntimeConfig {

    static final String DEFAULT_AGENT_NAME = "assistant";
    static final String DEFAULT_INSTRUCTIONS = """
            You are a helpful assistant. Think step-by-step about what you need,
            use the available tools one at a time when they help, and give a clear, concise final answer.
            If a tool returns an error, do not call it again with the same arguments.""";

    @Bean
    public ToolArgumentParser toolArgumentParser(ObjectMapper objectMapper) {
        return new ToolArgumentParser(objectMapper);
    }

    @Bean
    public LogRedactor logRedactor(AgentProperties properties) {
        return new LogRedactor(properties.getLogging().getRedactedKeys());
    }

    @Bean
    @ConditionalOnProperty(name = "agent.memory.persistence", havingValue = "jpa", matchIfMissing = true)
    public AgentPersistence jpaAgentPersistence(ChatMessageRepository messageRepository,
                                                CheckpointRepository checkpointRepository,
                                                ObjectMapper objectMapper) {
        log.info("Agent persistence: PostgreSQL (JPA)");
        return new JpaAgentPersistence(messageRepository, checkpointRepository, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "agent.memory.persistence", havingValue = "memory")
    public AgentPersistence inMemoryAgentPersistence() {
        log.info("Agent persistence: in-memory, nothing survives a restart");
        return new InMemoryAgentPersistence();
    }

    @Bean
    public ConversationSummarizer conversationSummarizer(LlmClient llmClient) {
        return new ConversationSummarizer(llmClient);
    }

    @Bean
    public ConversationMemory conversationMemory(AgentProperties properties,
                                                 ConversationSummarizer summarizer,
                                                 AgentPersistence persistence) {
        AgentProperties.Memory settings = properties.getMemory();
        ConversationMemory memory = new ConversationMemory(
                settings.getShortTermLimit(), settings.getLongTermLimit(), summarizer, persistence);
        memory.init();
        return memory;
    }

    @Bean
    public AgentCoordinator agentCoordinator(AgentProperties properties,
                                             LlmClient llmClient,
                                             ConversationMemory memory,
                                             List<AgentTool<?>> tools,
                                             ToolArgumentParser argumentParser,
                                             @Qualifier("toolExecutor") AsyncTaskExecutor toolExecutor,
                                             LogRedactor redactor,
                                             RunStateTracker runState) {
        List<AgentLoop> agents = new ArrayList<>();
        for (AgentProperties.AgentDefinition definition : definitions(properties)) {
            List<AgentTool<?>> allowed = selectTools(definition, tools);
            agents.add(AgentLoop.builder()
                    .name(definition.getName())
                    .description(definition.getDescription())
                    .instructions(definition.getInstructions() != null
                            ? definition.getInstructions() : DEFAULT_INSTRUCTIONS)
                    .llmClient(llmClient)
                    .memory(memory)
                    .toolRegistry(new ToolRegistry(allowed, argumentParser, toolExecutor, redactor))
                    .runState(runState)
                    .maxIterations(properties.getMaxIterations())
                    .maxPromptLength(properties.getMaxPromptLength())
                    .build());
            log.info("Agent configured [name={}, tools={}]", definition.getName(),
                    allowed.stream().map(AgentTool::getName).toList());
        }
        return new AgentCoordinator(agents);
    }

    private static List<AgentProperties.AgentDefinition> definitions(AgentProperties properties) {
        if (!properties.getAgents().isEmpty()) {
            return properties.getAgents();
        }
        AgentProperties.AgentDefinition fallback = new AgentProperties.AgentDefinition();
        fallback.setName(DEFAULT_AGENT_NAME);
        fallback.setDescription("General assistant agent");
        fallback.setInstructions(DEFAULT_INSTRUCTIONS);
        return List.of(fallback);
    }

    static List<AgentTool<?>> selectTools(AgentProperties.AgentDefinition definition, List<AgentTool<?>> tools) {
        if (definition.getTools() == null || definition.getTools().isEmpty()) {
            return tools;
        }
        List<AgentTool<?>> selected = tools.stream()
                .filter(t -> definition.getTools().contains(t.getName()))
                .toList();
        if (selected.size() < definition.getTools().size()) {
            log.warn("Agent [{}] names unknown tools, available: {}", definition.getName(),
                    tools.stream().map(AgentTool::getName).toList());
        }
        return selected;
    }
}
