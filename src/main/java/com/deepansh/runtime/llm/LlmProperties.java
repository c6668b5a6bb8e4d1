package com.deepansh.runtime.llm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Provider selection, per-provider settings, retry and HTTP pool settings.
 * Bound from the "llm" prefix.
 */
@ConfigurationProperties(prefix = "llm")
@Data
public class LlmProperties {

    /** openai | anthropic | gemini */
    private String provider = "openai";

    private LlmProviderProperties openai =
            LlmProviderProperties.of("https://api.openai.com/v1", "gpt-4o-mini", 1024);

    private LlmProviderProperties anthropic = anthropicDefaults();

    private LlmProviderProperties gemini =
            LlmProviderProperties.of("https://generativelanguage.googleapis.com/v1beta", "gemini-1.5-flash-latest", 8192);

    private Retry retry = new Retry();
    private Http http = new Http();

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double multiplier = 2.0;
    }

    @Data
    public static class Http {
        private int maxConnections = 20;
        private Duration connectTimeout = Duration.ofSeconds(10);
    }

    private static LlmProviderProperties anthropicDefaults() {
        LlmProviderProperties p = LlmProviderProperties.of(
                "https://api.anthropic.com/v1", "claude-3-5-sonnet-latest", 4096);
        p.setApiVersion("2023-06-01");
        return p;
    }
}
