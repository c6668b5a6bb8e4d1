package com.deepansh.runtime.llm.transport;

import org.apache.hc.core5.http.io.EofSensorInputStream;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.client.MockClientHttpResponse;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamingResponseTest {

    private static EofSensorInputStream pooledBody() {
        return new EofSensorInputStream(
                new ByteArrayInputStream("data: {}\n\n".getBytes(StandardCharsets.UTF_8)), null);
    }

    @Test
    void abort_pooledBody_dropsConnectionWithoutReadingIt() throws Exception {
        EofSensorInputStream body = pooledBody();
        StreamingResponse response = StreamingResponse.open(new MockClientHttpResponse(body, HttpStatus.OK));

        response.abort();

        assertThat(response.getBody()).isSameAs(body);
        assertThatThrownBy(body::read).isInstanceOf(IOException.class);
    }

    @Test
    void abort_afterClose_isNoOp() throws Exception {
        StreamingResponse response = StreamingResponse.open(new MockClientHttpResponse(pooledBody(), HttpStatus.OK));

        response.close();

        assertThatCode(response::abort).doesNotThrowAnyException();
    }
}
