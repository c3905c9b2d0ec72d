package dev.agentsdk.claude.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.agentsdk.claude.exceptions.CLIJSONDecodeException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonLineDecoderTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void decodesOneMessagePerLine() {
        JsonLineDecoder decoder = new JsonLineDecoder(mapper, 0);

        List<JsonNode> messages = decoder.decode("{\"type\":\"system\",\"subtype\":\"init\"}");

        assertThat(messages).hasSize(1);
        assertThat(messages.get(0).path("subtype").asText()).isEqualTo("init");
        assertThat(decoder.hasPendingData()).isFalse();
    }

    @Test
    void accumulatesMessageSplitAcrossLines() {
        JsonLineDecoder decoder = new JsonLineDecoder(mapper, 0);

        assertThat(decoder.decode("{\"type\":\"assistant\",")).isEmpty();
        assertThat(decoder.hasPendingData()).isTrue();
        List<JsonNode> messages = decoder.decode("\"message\":{\"content\":[]}}");

        assertThat(messages).hasSize(1);
        assertThat(messages.get(0).path("type").asText()).isEqualTo("assistant");
        assertThat(decoder.hasPendingData()).isFalse();
    }

    @Test
    void splitsEmbeddedNewlinesAndSkipsBlankLines() {
        JsonLineDecoder decoder = new JsonLineDecoder(mapper, 0);

        List<JsonNode> messages = decoder.decode("{\"n\":1}\n\n  {\"n\":2}  \n");

        assertThat(messages).extracting(node -> node.path("n").asInt()).containsExactly(1, 2);
    }

    @Test
    void overflowDiscardsBufferAndFails() {
        JsonLineDecoder decoder = new JsonLineDecoder(mapper, 16);

        assertThatThrownBy(() -> decoder.decode("{\"text\":\"" + "x".repeat(64)))
                .isInstanceOf(CLIJSONDecodeException.class)
                .hasRootCauseMessage("Buffer size 73 exceeds limit 16");
        assertThat(decoder.hasPendingData()).isFalse();
        assertThat(decoder.decode("{\"ok\":true}")).hasSize(1);
    }
}
