package com.deepansh.runtime.llm;

import com.deepansh.runtime.llm.transport.PooledHttpTransport;
import com.deepansh.runtime.resilience.LlmRetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Creates the active LLM client based on llm.provider.
 * Each client gets its own connection pool and retry policy; Spring closes it on shutdown.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    private final LlmProperties llm;

    public LlmClientConfig(LlmProperties llm) {
        this.llm = llm;
    }

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", provider().toUpperCase(Locale.ROOT));
        log.info("  Model               : {}", activeProps().getModel());
        log.info("================================================================");
    }

    @Bean(name = "activeLlmClient", destroyMethod = "close")
    public LlmClient activeLlmClient(ObjectMapper objectMapper) {
        PooledHttpTransport transport = PooledHttpTransport.create(llm.getHttp());

        return switch (provider()) {
            case "anthropic" -> {
                logKey("ANTHROPIC", llm.getAnthropic().getApiKey(), "ANTHROPIC_API_KEY");
                yield new AnthropicClient(llm.getAnthropic(), objectMapper, transport,
                        LlmRetryPolicy.withServerErrors(AnthropicClient.PROVIDER, llm.getRetry()));
            }
            case "gemini" -> {
                logKey("GEMINI", llm.getGemini().getApiKey(), "GEMINI_API_KEY");
                yield new GeminiClient(llm.getGemini(), objectMapper, transport,
                        LlmRetryPolicy.withServerErrors(GeminiClient.PROVIDER, llm.getRetry()));
            }
            case "openai" -> {
                logKey("OPENAI", llm.getOpenai().getApiKey(), "OPENAI_API_KEY");
                yield new OpenAiCompatibleClient("openai", llm.getOpenai(), objectMapper, transport,
                        LlmRetryPolicy.passThrough("openai", llm.getRetry()));
            }
            default -> {
                transport.close();
                throw new IllegalStateException("Unknown llm.provider '" + llm.getProvider()
                        + "', expected one of: openai, anthropic, gemini");
            }
        };
    }

    private String provider() {
        return llm.getProvider() == null ? "openai" : llm.getProvider().toLowerCase(Locale.ROOT);
    }

    private LlmProviderProperties activeProps() {
        return switch (provider()) {
            case "anthropic" -> llm.getAnthropic();
            case "gemini" -> llm.getGemini();
            default -> llm.getOpenai();
        };
    }

    private void logKey(String name, String key, String envVar) {
        if (key == null || key.isBlank()) {
            log.error("  {} API key not set! Set env var: {}={your-key}", name, envVar);
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
