package com.deepansh.runtime.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Runtime settings bound from the "agent" prefix.
 */
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private int maxIterations = 10;

    /** Prompts longer than this are rejected before any network call */
    private int maxPromptLength = 100_000;

    private Memory memory = new Memory();
    private Tools tools = new Tools();
    private Logging logging = new Logging();

    /** The first agent is active at startup. */
    private List<AgentDefinition> agents = new ArrayList<>();

    @Data
    public static class Memory {
        private int shortTermLimit = 10;
        private int longTermLimit = 5;
        private Persistence persistence = Persistence.JPA;
    }

    public enum Persistence {
        JPA, MEMORY
    }

    @Data
    public static class Tools {
        private int executorCoreSize = 2;
        private int executorMaxSize = 8;
        private int executorQueueCapacity = 50;
    }

    @Data
    public static class Logging {
        private List<String> redactedKeys = new ArrayList<>(
                List.of("api_key", "apiKey", "authorization", "token", "password", "secret"));
    }

    @Data
    public static class AgentDefinition {
        private String name;
        private String description;
        private String instructions;
        /** Names of the tools this agent may call, empty means every registered tool */
        private List<String> tools = new ArrayList<>();
    }
}
