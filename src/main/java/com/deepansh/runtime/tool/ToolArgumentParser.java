package com.deepansh.runtime.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tolerant decoder for model-generated tool arguments.
 *
 * Models wrap JSON in markdown fences, prefix it with prose, or emit garbage.
 * Decoding never throws: anything that cannot be read as a JSON object becomes
 * an empty map and the tool sees no arguments.
 */
@Slf4j
public class ToolArgumentParser {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:[a-zA-Z0-9_-]*)\\s*(.*?)\\s*```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public ToolArgumentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return new LinkedHashMap<>();
        }

        String candidate = raw.strip();
        Matcher fence = CODE_FENCE.matcher(candidate);
        if (fence.find()) {
            candidate = fence.group(1).strip();
        }

        Map<String, Object> parsed = tryParse(candidate);
        if (parsed != null) return parsed;

        int start = candidate.indexOf('{');
        int end = candidate.lastIndexOf('}');
        if (start >= 0 && end > start) {
            parsed = tryParse(candidate.substring(start, end + 1));
            if (parsed != null) return parsed;
        }

        log.warn("Could not decode tool arguments, using empty map. First 100 chars: '{}'",
                raw.substring(0, Math.min(100, raw.length())));
        return new LinkedHashMap<>();
    }

    private Map<String, Object> tryParse(String json) {
        if (!json.startsWith("{")) return null;
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
