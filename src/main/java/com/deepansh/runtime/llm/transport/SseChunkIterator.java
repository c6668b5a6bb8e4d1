package com.deepansh.runtime.llm.transport;

import com.deepansh.runtime.core.CancellationToken;
import com.deepansh.runtime.exception.LlmTransportException;
import com.deepansh.runtime.model.LlmChunk;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Pulls SSE events lazily through a decoder. The response is released when the
 * turn ends, and aborted when reading fails, the token is cancelled or the
 * consuming {@link Stream} is closed early.
 * On cancellation, chunks already decoded but not yet handed out are dropped.
 */
@Slf4j
public class SseChunkIterator implements Iterator<LlmChunk> {

    private final String provider;
    private final SseEventReader reader;
    private final SseStreamDecoder decoder;
    private final CancellationToken token;
    private final StreamingResponse response;
    private final Deque<LlmChunk> pending = new ArrayDeque<>();
    private boolean exhausted;

    public SseChunkIterator(String provider,
                            SseEventReader reader,
                            SseStreamDecoder decoder,
                            CancellationToken token,
                            StreamingResponse response) {
        this.provider = provider;
        this.reader = reader;
        this.decoder = decoder;
        this.token = token;
        this.response = response;
    }

    public static Stream<LlmChunk> stream(String provider,
                                          SseEventReader reader,
                                          SseStreamDecoder decoder,
                                          CancellationToken token,
                                          StreamingResponse response) {
        SseChunkIterator iterator = new SseChunkIterator(provider, reader, decoder, token, response);
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                        false)
                .onClose(iterator::abort);
    }

    @Override
    public boolean hasNext() {
        try {
            CancellationToken.check(token);
            while (pending.isEmpty() && !exhausted) {
                if (decoder.isFinished()) {
                    endOfTurn();
                    break;
                }
                SseEvent event = reader.next();
                if (event == null) {
                    endOfTurn();
                    break;
                }
                pending.addAll(decoder.decode(event));
            }
            return !pending.isEmpty();
        } catch (IOException e) {
            pending.clear();
            abort();
            throw new LlmTransportException(provider + " stream read failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            pending.clear();
            abort();
            throw e;
        }
    }

    @Override
    public LlmChunk next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return pending.poll();
    }

    private void endOfTurn() {
        exhausted = true;
        pending.addAll(decoder.finish());
        response.close();
    }

    private void abort() {
        if (!exhausted) {
            log.debug("Aborting {} stream before end of turn", provider);
        }
        exhausted = true;
        response.abort();
    }
}
