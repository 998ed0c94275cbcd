package com.hvacops.copilot.client.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hvacops.copilot.client.model.CopilotReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Consumes an event-stream body: hands each delta to the listener in arrival order and resolves
 * with the first terminal reply. A body that ends without one fails with
 * {@link StreamIncompleteException}; transport errors pass through unchanged.
 */
public class StreamingReplyReader {

    private static final Logger log = LoggerFactory.getLogger(StreamingReplyReader.class);

    private final ObjectMapper objectMapper;

    public StreamingReplyReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Mono<CopilotReply> read(Flux<DataBuffer> body, DeltaListener listener) {
        return readChunks(body.map(StreamingReplyReader::drain), listener);
    }

    public Mono<CopilotReply> readChunks(Flux<byte[]> chunks, DeltaListener listener) {
        return Mono.defer(() -> {
            SseFrameDecoder decoder = new SseFrameDecoder(objectMapper);
            AtomicReference<CopilotReply> terminal = new AtomicReference<>();
            return chunks.concatMapIterable(decoder::feed)
                    .concatWith(Flux.defer(() -> Flux.fromIterable(decoder.finish())))
                    .doOnNext(frame -> apply(frame, terminal, listener))
                    .then(Mono.defer(() -> {
                        CopilotReply reply = terminal.get();
                        return reply == null ? Mono.error(new StreamIncompleteException()) : Mono.just(reply);
                    }));
        });
    }

    private void apply(DecodedFrame frame, AtomicReference<CopilotReply> terminal, DeltaListener listener) {
        switch (frame.kind()) {
            case DELTA -> listener.onDelta(frame.delta());
            case TERMINAL -> {
                if (!terminal.compareAndSet(null, frame.reply())) {
                    log.debug("Ignoring additional terminal record");
                }
            }
            default -> {
            }
        }
    }

    private static byte[] drain(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }
}
