package com.deepansh.runtime.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Strongly-typed configuration for the built-in tools.
 * Bound from application.yml under the "tools" prefix.
 */
@ConfigurationProperties(prefix = "tools")
@Data
public class ToolProperties {

    private RestApiCaller restApiCaller = new RestApiCaller();

    @Data
    public static class RestApiCaller {
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 10000;
        /** Comma-separated allowlist, empty means allow all */
        private String allowedDomains = "";
        /** Hosts that are never reachable, whatever the allowlist says */
        private List<String> blockedHosts = new ArrayList<>(List.of(
                "localhost", "127.0.0.1", "0.0.0.0", "::1",
                "169.254.169.254", "metadata.google.internal"));

        public List<String> getAllowedDomainList() {
            if (allowedDomains == null || allowedDomains.isBlank()) return List.of();
            return Arrays.stream(allowedDomains.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isBlank())
                    .toList();
        }
    }
}
