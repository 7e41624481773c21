package com.tessera.pipeline.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tessera.eventmodel.EventTypeName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HandlerRegistry")
class HandlerRegistryTest {

    private final HandlerRegistry registry = new HandlerRegistry();

    @Test
    @DisplayName("returns matching handlers in registration order")
    void matching() {
        registry.register("governor", "*.*.requested", e -> "g")
                .register("audit", "*", e -> "a")
                .register("entities", "entities.*.validated", e -> "e");

        assertThat(registry.handlersFor(EventTypeName.parse("entities.create.requested")))
                .extracting(HandlerRegistry.Registration::name)
                .containsExactly("governor", "audit");
        assertThat(registry.handlersFor(EventTypeName.parse("entities.create.validated")))
                .extracting(HandlerRegistry.Registration::name)
                .containsExactly("audit", "entities");
    }

    @Test
    @DisplayName("refuses a second handler under the same name")
    void duplicateName() {
        registry.register("governor", "*.*.requested", e -> null);

        assertThatThrownBy(() -> registry.register("governor", "*", e -> null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("governor");
    }

    @Test
    @DisplayName("unregister removes the handler")
    void unregister() {
        registry.register("audit", "*", e -> null);

        assertThat(registry.unregister("audit")).isTrue();
        assertThat(registry.handlersFor(EventTypeName.parse("entities.create.requested"))).isEmpty();
    }

    @Test
    @DisplayName("registries are independent values")
    void independent() {
        registry.register("audit", "*", e -> null);

        assertThat(new HandlerRegistry().registrations()).isEmpty();
    }
}
