package com.acme.cqrs.usecase;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class InMemoryUseCaseRegistryTest {

    private final InMemoryUseCaseRegistry registry = new InMemoryUseCaseRegistry();

    @Test
    @DisplayName("register - should make the use case retrievable by name")
    void testRegister() {
        UseCase<String, Integer> length = String::length;

        registry.register("length", length);

        assertThat(registry.has("length")).isTrue();
        assertThat(registry.get("length")).containsSame(length);
        assertThat(registry.getNames()).containsExactly("length");
    }

    @Test
    @DisplayName("register - duplicate name should fail")
    void testDuplicate() {
        registry.register("length", (UseCase<String, Integer>) String::length);

        assertThatThrownBy(() -> registry.register("length", (UseCase<String, String>) s -> s))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("get - unknown name should be empty")
    void testUnknown() {
        assertThat(registry.get("missing")).isEmpty();
        assertThat(registry.has("missing")).isFalse();
    }
}
