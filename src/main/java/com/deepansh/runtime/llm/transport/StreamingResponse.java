package com.deepansh.runtime.llm.transport;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.core5.http.io.EofSensorInputStream;
import org.springframework.http.client.ClientHttpResponse;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * An open streamed HTTP response. {@link #close()} lets the pool reuse the
 * connection; {@link #abort()} drops it without reading the rest of the body,
 * which is what a cancelled or abandoned stream needs.
 */
@Slf4j
public class StreamingResponse implements Closeable {

    private final ClientHttpResponse response;
    private final InputStream body;
    private boolean released;

    private StreamingResponse(ClientHttpResponse response, InputStream body) {
        this.response = response;
        this.body = body;
    }

    public static StreamingResponse open(ClientHttpResponse response) throws IOException {
        return new StreamingResponse(response, response.getBody());
    }

    public InputStream getBody() {
        return body;
    }

    public synchronized void abort() {
        if (released) return;
        if (body instanceof EofSensorInputStream eof) {
            try {
                eof.abort();
            } catch (IOException e) {
                log.debug("Abort of streamed connection failed: {}", e.getMessage());
            }
        }
        close();
    }

    @Override
    public synchronized void close() {
        if (released) return;
        released = true;
        response.close();
    }
}
