package com.deepansh.runtime.llm.transport;

import com.deepansh.runtime.core.CancellationToken;
import com.deepansh.runtime.exception.AgentCancelledException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SseEventReaderTest {

    private static SseEventReader reader(String body, CancellationToken token) {
        return new SseEventReader(new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)), token);
    }

    @Test
    void next_readsNamedAndUnnamedEvents() throws IOException {
        SseEventReader reader = reader("event: message_start\ndata: {\"a\":1}\n\ndata: {\"b\":2}\n\n", null);

        assertThat(reader.next()).isEqualTo(new SseEvent("message_start", "{\"a\":1}"));
        assertThat(reader.next()).isEqualTo(new SseEvent(null, "{\"b\":2}"));
        assertThat(reader.next()).isNull();
    }

    @Test
    void next_joinsMultiLineDataWithNewlines() throws IOException {
        SseEventReader reader = reader("data: first\ndata: second\n\n", null);

        assertThat(reader.next().data()).isEqualTo("first\nsecond");
    }

    @Test
    void next_ignoresCommentsIdsAndBlankKeepAlives() throws IOException {
        SseEventReader reader = reader(": keep-alive\n\n\nid: 7\nretry: 1000\ndata:x\n\n", null);

        assertThat(reader.next()).isEqualTo(new SseEvent(null, "x"));
    }

    @Test
    void next_handlesCrLfAndUnterminatedLastEvent() throws IOException {
        SseEventReader reader = reader("data: a\r\n\r\ndata: b", null);

        assertThat(reader.next().data()).isEqualTo("a");
        assertThat(reader.next().data()).isEqualTo("b");
        assertThat(reader.next()).isNull();
    }

    @Test
    void next_cancelledToken_stopsReading() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        SseEventReader reader = reader("data: a\n\n", token);

        assertThatThrownBy(reader::next).isInstanceOf(AgentCancelledException.class);
    }
}
