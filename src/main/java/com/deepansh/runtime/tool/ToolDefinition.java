package com.deepansh.runtime.tool;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the model sees of a tool, in each provider's wire shape.
 */
@Value
@Builder
public class ToolDefinition {

    String name;
    String description;
    Map<String, Object> inputSchema;

    public static ToolDefinition from(AgentTool<?> tool) {
        return ToolDefinition.builder()
                .name(tool.getName())
                .description(tool.getDescription())
                .inputSchema(tool.getInputSchema())
                .build();
    }

    /** {@code {"type":"function","function":{name, description, parameters}}} */
    public Map<String, Object> toOpenAiSchema() {
        Map<String, Object> tool = new LinkedHashMap<>();
        tool.put("type", "function");
        tool.put("function", describe("parameters"));
        return tool;
    }

    /** {@code {name, description, input_schema}} */
    public Map<String, Object> toAnthropicSchema() {
        return describe("input_schema");
    }

    /** One entry of Gemini's {@code functionDeclarations}. */
    public Map<String, Object> toGeminiDeclaration() {
        return describe("parameters");
    }

    private Map<String, Object> describe(String schemaKey) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", name);
        m.put("description", description);
        m.put(schemaKey, inputSchema);
        return m;
    }
}
