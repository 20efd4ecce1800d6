package com.umitunal.taskq.serialization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class StringCodecTest {

    private final StringCodec codec = new StringCodec();

    @Test
    @DisplayName("Should keep non-ASCII text intact")
    void testUnicode() {
        String payload = "Günaydın, 世界";

        assertThat(codec.decode(codec.encode(payload))).isEqualTo(payload);
        assertThat(codec.encode("")).isEmpty();
    }

    @Test
    @DisplayName("Should report invalid UTF-8 instead of replacing it")
    void testMalformedBytes() {
        assertThatThrownBy(() -> codec.decode(new byte[]{(byte) 0xC3, (byte) 0x28}))
                .isInstanceOf(CodecException.class)
                .hasMessageContaining("UTF-8");
    }

    @Test
    @DisplayName("Should report a lone surrogate on encode")
    void testLoneSurrogate() {
        assertThatThrownBy(() -> codec.encode("broken \uD800 text"))
                .isInstanceOf(CodecException.class);
    }
}
