package com.umitunal.taskq.worker;

import com.umitunal.taskq.core.DuplicateRegistrationException;
import com.umitunal.taskq.core.RegistrationPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class HandlerRegistryTest {

    @Test
    @DisplayName("Replacing policy keeps the latest handler and returns the previous one")
    void testReplace() {
        HandlerRegistry<String> registry = new HandlerRegistry<>("job handler", RegistrationPolicy.REPLACE);

        assertThat(registry.register("send-email", "first")).isNull();
        assertThat(registry.register("send-email", "second")).isEqualTo("first");

        assertThat(registry.find("send-email")).contains("second");
        assertThat(registry.names()).containsExactly("send-email");
    }

    @Test
    @DisplayName("Rejecting policy keeps the first handler")
    void testReject() {
        HandlerRegistry<String> registry = new HandlerRegistry<>("schedule", RegistrationPolicy.REJECT);
        registry.register("nightly", "first");

        assertThatThrownBy(() -> registry.register("nightly", "second"))
                .isInstanceOf(DuplicateRegistrationException.class)
                .hasMessage("schedule already registered: nightly");
        assertThat(registry.find("nightly")).contains("first");
    }

    @Test
    @DisplayName("Should remove handlers by name")
    void testRemove() {
        HandlerRegistry<String> registry = new HandlerRegistry<>("job handler", RegistrationPolicy.REPLACE);
        registry.register("a", "handler-a");
        registry.register("b", "handler-b");

        assertThat(registry.remove("a")).contains("handler-a");
        assertThat(registry.remove("a")).isEmpty();
        assertThat(registry.contains("a")).isFalse();
        assertThat(registry.handlers()).containsExactly("handler-b");
    }

    @Test
    @DisplayName("Should reject blank names and null handlers")
    void testValidation() {
        HandlerRegistry<String> registry = new HandlerRegistry<>("job handler", RegistrationPolicy.REPLACE);

        assertThatThrownBy(() -> registry.register("", "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register(null, "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register("a", null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Revert restores the replaced handler only while the reverted one is still current")
    void testRevert() {
        HandlerRegistry<String> registry = new HandlerRegistry<>("schedule", RegistrationPolicy.REPLACE);
        registry.register("nightly", "old");
        String previous = registry.register("nightly", "new");

        assertThat(registry.revert("nightly", "new", previous)).isTrue();
        assertThat(registry.find("nightly")).contains("old");

        registry.register("fresh", "first");
        registry.register("fresh", "second");
        assertThat(registry.revert("fresh", "first", null)).isFalse();
        assertThat(registry.find("fresh")).contains("second");

        registry.register("added", "only");
        assertThat(registry.revert("added", "only", null)).isTrue();
        assertThat(registry.contains("added")).isFalse();
    }
}
