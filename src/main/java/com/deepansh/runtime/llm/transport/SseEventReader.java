package com.deepansh.runtime.llm.transport;

import com.deepansh.runtime.core.CancellationToken;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Minimal text/event-stream framer: accumulates "event:" and "data:" lines and
 * dispatches on a blank line. Comment lines (":") and "id:"/"retry:" fields are ignored.
 *
 * The cancellation token is checked before every line read, so no further
 * bytes are consumed once a turn is cancelled.
 */
public class SseEventReader {

    private final BufferedReader reader;
    private final CancellationToken token;

    public SseEventReader(InputStream body, CancellationToken token) {
        this.reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8));
        this.token = token;
    }

    /** Next event, or null at end of stream. */
    public SseEvent next() throws IOException {
        String eventName = null;
        StringBuilder data = null;

        while (true) {
            CancellationToken.check(token);
            String line = reader.readLine();

            if (line == null) {
                return data != null ? new SseEvent(eventName, data.toString()) : null;
            }

            if (line.isEmpty()) {
                if (data != null) {
                    return new SseEvent(eventName, data.toString());
                }
                eventName = null;
                continue;
            }

            if (line.startsWith(":")) continue;

            int colon = line.indexOf(':');
            String field = colon >= 0 ? line.substring(0, colon) : line;
            String value = colon >= 0 ? line.substring(colon + 1) : "";
            if (value.startsWith(" ")) value = value.substring(1);

            switch (field) {
                case "event" -> eventName = value;
                case "data" -> {
                    if (data == null) {
                        data = new StringBuilder(value);
                    } else {
                        data.append('\n').append(value);
                    }
                }
                default -> {
                    // id, retry and unknown fields are not used by any provider we talk to
                }
            }
        }
    }
}
