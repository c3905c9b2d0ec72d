package dev.agentsdk.claude.transport;

import dev.agentsdk.claude.exceptions.CLIJSONDecodeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns CLI stdout lines into JSON messages.
 * <p>
 * A message split across several lines is accumulated until it parses. The
 * buffer is bounded; exceeding it discards the partial message and fails.
 * Not thread-safe.
 */
public final class JsonLineDecoder {

    public static final int DEFAULT_MAX_BUFFER_SIZE = 1024 * 1024;

    private final ObjectMapper mapper;
    private final int maxBufferSize;
    private final StringBuilder buffer = new StringBuilder();
    private int bufferedBytes;

    public JsonLineDecoder(ObjectMapper mapper, int maxBufferSize) {
        this.mapper = mapper;
        this.maxBufferSize = maxBufferSize > 0 ? maxBufferSize : DEFAULT_MAX_BUFFER_SIZE;
    }

    /**
     * Feed one line of output.
     *
     * @return the messages completed by this line, possibly none
     * @throws CLIJSONDecodeException if the accumulated text exceeds the buffer limit
     */
    public List<JsonNode> decode(String line) {
        List<JsonNode> messages = new ArrayList<>();
        for (String part : line.split("\n")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            buffer.append(trimmed);
            bufferedBytes += trimmed.getBytes(StandardCharsets.UTF_8).length;
            if (bufferedBytes > maxBufferSize) {
                String overflow = buffer.toString();
                int size = bufferedBytes;
                reset();
                throw new CLIJSONDecodeException(overflow, new IllegalStateException(
                        "Buffer size " + size + " exceeds limit " + maxBufferSize));
            }
            JsonNode message = tryParse();
            if (message != null) {
                messages.add(message);
                reset();
            }
        }
        return messages;
    }

    public boolean hasPendingData() {
        return buffer.length() > 0;
    }

    /**
     * @return the parsed message, or {@code null} while the buffered text is incomplete
     */
    @Nullable
    private JsonNode tryParse() {
        try {
            return mapper.readTree(buffer.toString());
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private void reset() {
        buffer.setLength(0);
        bufferedBytes = 0;
    }
}
