package com.deepansh.runtime.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated thread pools, isolated from the web thread pool.
 *
 * - toolExecutor: runs tool calls so each one can be bounded by its timeout
 * - streamExecutor: pumps streamed agent turns into SSE connections
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "toolExecutor")
    public ThreadPoolTaskExecutor toolExecutor(AgentProperties properties) {
        AgentProperties.Tools tools = properties.getTools();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(tools.getExecutorCoreSize());
        executor.setMaxPoolSize(tools.getExecutorMaxSize());
        executor.setQueueCapacity(tools.getExecutorQueueCapacity());
        executor.setThreadNamePrefix("tool-exec-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean(name = "streamExecutor")
    public ThreadPoolTaskExecutor streamExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(10);
        executor.setThreadNamePrefix("agent-stream-");
        return executor;
    }
}
