package com.deepansh.runtime.tool.impl;

import com.deepansh.runtime.config.ToolProperties;
import com.deepansh.runtime.tool.AgentTool;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Generic HTTP REST API caller tool.
 *
 * Security controls:
 * - Domain allowlist: tools.rest-api-caller.allowed-domains (comma-separated), empty = allow all
 * - Blocked hosts (loopback, cloud metadata endpoints) are refused regardless of the allowlist
 * - Only http and https URLs
 * - Any method other than GET needs explicit user confirmation
 * - Response is truncated at 4000 chars to avoid context window bloat
 */
@Component
@Slf4j
public class RestApiCallerTool implements AgentTool<RestApiCallerTool.Args> {

    private static final int MAX_RESPONSE_CHARS = 4000;
    private static final List<String> ALLOWED_METHODS = List.of("GET", "POST", "PUT", "PATCH", "DELETE");

    public record Args(String url, String method, Map<String, String> headers, String body) {}

    private final ToolProperties toolProperties;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public RestApiCallerTool(ToolProperties toolProperties, ObjectMapper objectMapper) {
        this.toolProperties = toolProperties;
        this.objectMapper = objectMapper;

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(toolProperties.getRestApiCaller().getConnectTimeoutMs()))
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(toolProperties.getRestApiCaller().getReadTimeoutMs()));

        this.restClient = RestClient.builder()
                .requestFactory(requestFactory)
                .requestInterceptor((request, body, execution) -> {
                    log.debug("Outbound API call: {} {}", request.getMethod(), request.getURI());
                    return execution.execute(request, body);
                })
                .build();
    }

    @Override
    public String getName() {
        return "call_api";
    }

    @Override
    public String getDescription() {
        return """
                Make an HTTP request to an external REST API.
                Supports GET, POST, PUT, PATCH and DELETE. Anything but GET needs user confirmation.
                Always include required authentication headers if the API needs them.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "url", Map.of(
                                "type", "string",
                                "description", "Full URL to call. E.g: https://api.github.com/repos/owner/repo"
                        ),
                        "method", Map.of(
                                "type", "string",
                                "enum", ALLOWED_METHODS,
                                "description", "HTTP method. Default: GET"
                        ),
                        "headers", Map.of(
                                "type", "object",
                                "description", "Request headers as key-value pairs",
                                "additionalProperties", Map.of("type", "string")
                        ),
                        "body", Map.of(
                                "type", "string",
                                "description", "Request body as a JSON string (for POST/PUT/PATCH)"
                        ),
                        "confirmed", Map.of(
                                "type", "boolean",
                                "description", "Set to true only after the user approved a non-GET request"
                        )
                ),
                "required", List.of("url")
        );
    }

    @Override
    public Args parseArguments(Map<String, Object> raw) {
        Object url = raw.get("url");
        Object method = raw.getOrDefault("method", "GET");
        Map<String, String> headers = new LinkedHashMap<>();
        if (raw.get("headers") instanceof Map<?, ?> rawHeaders) {
            rawHeaders.forEach((k, v) -> headers.put(String.valueOf(k), String.valueOf(v)));
        }
        Object body = raw.get("body");
        return new Args(
                url != null ? url.toString() : null,
                method != null ? method.toString().toUpperCase(Locale.ROOT) : "GET",
                headers,
                body != null ? body.toString() : null);
    }

    @Override
    public boolean requiresConfirmation(Args arguments) {
        return !"GET".equals(arguments.method());
    }

    @Override
    public String execute(Args args) {
        if (args.url() == null || args.url().isBlank()) {
            return "ERROR: 'url' is required";
        }

        if (!ALLOWED_METHODS.contains(args.method())) {
            return "ERROR: Method '" + args.method() + "' is not allowed. Use: " + ALLOWED_METHODS;
        }

        String hostError = checkHost(args.url());
        if (hostError != null) return hostError;

        log.info("API call: {} {}", args.method(), args.url());

        try {
            return performRequest(args);
        } catch (RestClientResponseException e) {
            return String.format("HTTP %d\n\n%s", e.getStatusCode().value(),
                    truncate(tryPrettyPrint(e.getResponseBodyAsString())));
        } catch (Exception e) {
            log.error("API call failed: {} {}", args.method(), args.url(), e);
            return "ERROR: API call failed: " + e.getMessage();
        }
    }

    private String performRequest(Args args) {
        var requestSpec = restClient.method(HttpMethod.valueOf(args.method())).uri(URI.create(args.url()));

        args.headers().forEach((name, value) -> requestSpec.header(name, value));

        if (args.body() != null && !args.body().isBlank() && !"GET".equals(args.method())) {
            requestSpec
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(args.body());
        }

        ResponseEntity<String> response = requestSpec
                .retrieve()
                .toEntity(String.class);

        int statusCode = response.getStatusCode().value();
        String responseBody = response.getBody();

        log.info("API response: status={} body-length={}", statusCode,
                responseBody != null ? responseBody.length() : 0);

        String formattedBody = truncate(tryPrettyPrint(responseBody));
        return String.format("HTTP %d\n\n%s", statusCode,
                formattedBody != null ? formattedBody : "(empty response)");
    }

    private String truncate(String body) {
        if (body != null && body.length() > MAX_RESPONSE_CHARS) {
            return body.substring(0, MAX_RESPONSE_CHARS)
                    + "\n... [truncated, " + (body.length() - MAX_RESPONSE_CHARS) + " more chars]";
        }
        return body;
    }

    private String tryPrettyPrint(String body) {
        if (body == null || body.isEmpty()) return null;
        try {
            Object parsed = objectMapper.readValue(body, Object.class);
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(parsed);
        } catch (Exception e) {
            return body; // not JSON
        }
    }

    private String checkHost(String url) {
        String host;
        try {
            URI uri = URI.create(url);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return "ERROR: Only http and https URLs are supported: " + url;
            }
            host = uri.getHost();
            if (host == null) {
                return "ERROR: Invalid URL format: " + url;
            }
        } catch (IllegalArgumentException e) {
            return "ERROR: Invalid URL format: " + url;
        }

        String normalizedHost = host.toLowerCase(Locale.ROOT).replace("[", "").replace("]", "");
        ToolProperties.RestApiCaller settings = toolProperties.getRestApiCaller();
        if (settings.getBlockedHosts().stream().anyMatch(b -> b.equalsIgnoreCase(normalizedHost))) {
            log.warn("Blocked API call to restricted host: {}", host);
            return "ERROR: Access to host '" + host + "' is blocked";
        }

        List<String> allowedDomains = settings.getAllowedDomainList();
        if (allowedDomains.isEmpty()) return null;

        boolean allowed = allowedDomains.stream()
                .anyMatch(domain -> normalizedHost.equals(domain) || normalizedHost.endsWith("." + domain));
        if (!allowed) {
            return "ERROR: Domain '" + host + "' is not in the allowed list. Allowed: " + allowedDomains;
        }
        return null;
    }
}
