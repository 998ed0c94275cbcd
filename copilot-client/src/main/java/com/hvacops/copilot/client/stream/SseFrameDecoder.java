package com.hvacops.copilot.client.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hvacops.copilot.client.model.CopilotReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Incremental decoder for {@code data: <json>} records separated by a blank line.
 *
 * <p>Chunks may split a record, a line ending or a multi-byte UTF-8 character anywhere; the
 * incomplete tail is carried over to the next {@link #feed} call. Instances are single-use and
 * not thread-safe.</p>
 */
public class SseFrameDecoder {

    private static final Logger log = LoggerFactory.getLogger(SseFrameDecoder.class);
    private static final String SEPARATOR = "\n\n";
    private static final String DATA_FIELD = "data:";

    private final ObjectMapper objectMapper;
    private final CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    private final StringBuilder pending = new StringBuilder();
    private ByteBuffer carry = ByteBuffer.allocate(0);

    public SseFrameDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<DecodedFrame> feed(byte[] chunk) {
        ByteBuffer input = ByteBuffer.allocate(carry.remaining() + chunk.length);
        input.put(carry).put(chunk).flip();
        CharBuffer output = CharBuffer.allocate(input.remaining() + 1);
        utf8.decode(input, output, false);
        carry = input.slice();
        output.flip();
        return feed(output.toString());
    }

    public List<DecodedFrame> feed(String text) {
        pending.append(text);
        normalizeLineEndings();
        List<DecodedFrame> frames = new ArrayList<>();
        int separator = pending.indexOf(SEPARATOR);
        while (separator >= 0) {
            frames.add(decodeRecord(pending.substring(0, separator)));
            pending.delete(0, separator + SEPARATOR.length());
            separator = pending.indexOf(SEPARATOR);
        }
        return frames;
    }

    /**
     * Decodes whatever is left once the stream has ended, including a final record that was
     * never followed by a separator.
     */
    public List<DecodedFrame> finish() {
        CharBuffer output = CharBuffer.allocate(carry.remaining() + 2);
        utf8.decode(carry, output, true);
        utf8.flush(output);
        utf8.reset();
        carry = ByteBuffer.allocate(0);
        output.flip();

        List<DecodedFrame> frames = new ArrayList<>(feed(output.toString()));
        String tail = pending.toString().replace("\r", "");
        pending.setLength(0);
        if (!tail.isBlank()) {
            frames.add(decodeRecord(tail));
        }
        return frames;
    }

    private void normalizeLineEndings() {
        int index = pending.indexOf("\r\n");
        while (index >= 0) {
            pending.deleteCharAt(index);
            index = pending.indexOf("\r\n", index);
        }
    }

    DecodedFrame decodeRecord(String record) {
        String payload = dataPayload(record);
        if (payload == null || payload.isEmpty()) {
            return DecodedFrame.skip();
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("Discarding malformed stream record: {}", e.getOriginalMessage());
            return DecodedFrame.unparseable();
        }
        if (node == null || !node.isObject()) {
            return DecodedFrame.skip();
        }

        JsonNode delta = node.get("delta");
        if (delta != null && delta.isTextual()) {
            return DecodedFrame.delta(delta.asText());
        }
        if (node.has("answer")) {
            try {
                return DecodedFrame.terminal(objectMapper.treeToValue(node, CopilotReply.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.debug("Discarding terminal record with unexpected shape: {}", e.getMessage());
                return DecodedFrame.unparseable();
            }
        }
        if (node.hasNonNull("error")) {
            log.warn("Copilot server reported an error mid-stream: {}", node.get("error").asText());
        }
        return DecodedFrame.skip();
    }

    private String dataPayload(String record) {
        StringBuilder data = null;
        for (String line : record.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.startsWith(DATA_FIELD)) {
                continue;
            }
            String value = trimmed.substring(DATA_FIELD.length()).trim();
            if (data == null) {
                data = new StringBuilder(value);
            } else {
                data.append('\n').append(value);
            }
        }
        return data == null ? null : data.toString().trim();
    }
}
