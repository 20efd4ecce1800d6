package com.umitunal.taskq.serialization;

import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class JsonCodecTest {

    @Test
    @DisplayName("Should encode free-form maps as JSON objects")
    void testMapCodec() {
        // Given
        JsonCodec<Map<String, Object>> codec = JsonCodec.forMap();

        // When
        byte[] encoded = codec.encode(Map.of("n", 1));
        Map<String, Object> decoded = codec.decode("{\"n\":2,\"tags\":[\"a\",\"b\"]}".getBytes(StandardCharsets.UTF_8));

        // Then
        assertThat(new String(encoded, StandardCharsets.UTF_8)).isEqualTo("{\"n\":1}");
        assertThat(decoded).containsEntry("n", 2).containsEntry("tags", List.of("a", "b"));
    }

    @Test
    @DisplayName("Should bind to a payload class and ignore unknown properties")
    void testClassCodec() {
        JsonCodec<Webhook> codec = new JsonCodec<>(Webhook.class);

        Webhook decoded = codec.decode(
                "{\"url\":\"https://example.com/hook\",\"attempt\":2,\"extra\":true}".getBytes(StandardCharsets.UTF_8));

        assertThat(decoded.url).isEqualTo("https://example.com/hook");
        assertThat(decoded.attempt).isEqualTo(2);
    }

    @Test
    @DisplayName("Should decode generic types through a TypeReference")
    void testTypeReference() {
        JsonCodec<List<Webhook>> codec = new JsonCodec<>(new TypeReference<List<Webhook>>() {
        });

        List<Webhook> decoded = codec.decode("[{\"url\":\"a\"},{\"url\":\"b\"}]".getBytes(StandardCharsets.UTF_8));

        assertThat(decoded).extracting(hook -> hook.url).containsExactly("a", "b");
    }

    @Test
    @DisplayName("Should report malformed JSON as CodecException")
    void testMalformed() {
        JsonCodec<Map<String, Object>> codec = JsonCodec.forMap();

        assertThatThrownBy(() -> codec.decode("{not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(CodecException.class);
    }

    public static class Webhook {
        public String url;
        public int attempt;
    }
}
