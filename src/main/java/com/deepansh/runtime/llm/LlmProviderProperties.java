package com.deepansh.runtime.llm;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Holds config for a single LLM provider.
 * Populated from application.yml under llm.openai / llm.anthropic / llm.gemini.
 */
@Data
public class LlmProviderProperties {
    private String apiKey;
    private String baseUrl;
    private String model;
    private int maxTokens;
    private double temperature = 0.7;
    private Double topP;
    private List<String> stop = new ArrayList<>();
    /** Only used by Anthropic, sent as the anthropic-version header */
    private String apiVersion;

    public static LlmProviderProperties of(String baseUrl, String model, int maxTokens) {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setBaseUrl(baseUrl);
        p.setModel(model);
        p.setMaxTokens(maxTokens);
        return p;
    }
}
