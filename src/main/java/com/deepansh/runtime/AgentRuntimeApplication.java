package com.deepansh.runtime;

import com.deepansh.runtime.config.AgentProperties;
import com.deepansh.runtime.config.ToolProperties;
import com.deepansh.runtime.llm.LlmProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({AgentProperties.class, LlmProperties.class, ToolProperties.class})
public class AgentRuntimeApplication {
    public static void main(String[] args) {
        SpringApplication.run(AgentRuntimeApplication.class, args);
    }
}
