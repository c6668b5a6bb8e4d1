package com.deepansh.runtime.llm.transport;

import com.deepansh.runtime.llm.LlmProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.io.Closeable;
import java.io.IOException;

/**
 * Pooled Apache HttpClient 5 connection manager owned by one LLM client.
 * Connections are reused across calls and released by {@link #close()}.
 *
 * No response timeout is set: streamed completions can legitimately stay open for minutes.
 */
@Slf4j
public class PooledHttpTransport implements Closeable {

    private final CloseableHttpClient httpClient;

    private PooledHttpTransport(CloseableHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public static PooledHttpTransport create(LlmProperties.Http settings) {
        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(settings.getMaxConnections())
                .setMaxConnPerRoute(settings.getMaxConnections())
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(Timeout.of(settings.getConnectTimeout()))
                        .build())
                .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .disableAutomaticRetries()
                .build();

        log.debug("HttpClient pool created [maxConnections={}]", settings.getMaxConnections());
        return new PooledHttpTransport(httpClient);
    }

    /** A fresh builder bound to this pool; callers add base URL and headers. */
    public RestClient.Builder restClientBuilder() {
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }

    @Override
    public void close() {
        try {
            httpClient.close();
        } catch (IOException e) {
            log.warn("Failed to close HTTP connection pool: {}", e.getMessage());
        }
    }
}
