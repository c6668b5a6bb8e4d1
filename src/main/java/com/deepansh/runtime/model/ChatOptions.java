package com.deepansh.runtime.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/** Per-call sampling parameters. Null fields fall back to the provider defaults from config. */
@Data
@Builder
public class ChatOptions {

    private Double temperature;
    private Integer maxTokens;
    private Double topP;
    private List<String> stop;

    public static ChatOptions defaults() {
        return ChatOptions.builder().build();
    }
}
