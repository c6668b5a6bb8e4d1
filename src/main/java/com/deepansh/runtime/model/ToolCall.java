package com.deepansh.runtime.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A tool invocation requested by the model.
 * {@code arguments} is the raw text the model produced; it is untrusted
 * and may be wrapped in prose or code fences. Decoding happens at dispatch time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    /** Provider-assigned, or derived from the function name where the provider has no ids */
    private String id;

    private String toolName;

    private String arguments;
}
