package com.deepansh.runtime.llm;

import com.deepansh.runtime.exception.AgentException;
import com.deepansh.runtime.model.TokenUsage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/** JSON helpers shared by the provider adapters. */
final class JsonSupport {

    private JsonSupport() {
    }

    static String toJson(ObjectMapper objectMapper, Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new AgentException("Failed to serialize request body", e);
        }
    }

    static JsonNode readTree(ObjectMapper objectMapper, String provider, String body) {
        if (body == null || body.isBlank()) {
            throw new AgentException(provider + " returned an empty response body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new AgentException(provider + " returned a response that is not JSON: " + abbreviate(body), e);
        }
    }

    static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }

    /** Usage object with the given field names, or null when the node is absent. */
    static TokenUsage usage(JsonNode node, String promptField, String completionField, String totalField) {
        if (node == null || !node.isObject()) return null;
        int prompt = node.path(promptField).asInt(0);
        int completion = node.path(completionField).asInt(0);
        int total = totalField != null && node.has(totalField) ? node.path(totalField).asInt(0) : prompt + completion;
        return new TokenUsage(prompt, completion, total);
    }

    static String abbreviate(String text) {
        if (text == null) return "";
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
