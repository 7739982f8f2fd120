package com.acme.cqrs.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class JsonsTest {

    static class State {
        private String owner;
        private Instant openedAt;

        State() {
        }

        State(String owner, Instant openedAt) {
            this.owner = owner;
            this.openedAt = openedAt;
        }
    }

    @Test
    @DisplayName("toJson - should serialize fields and ISO instants")
    void testFieldSerialization() {
        String json = Jsons.toJson(new State("alice", Instant.parse("2025-01-01T00:00:00Z")));

        assertThat(json).contains("\"owner\":\"alice\"").contains("2025-01-01T00:00:00Z");
    }

    @Test
    @DisplayName("fromJson - should restore private fields and ignore unknown properties")
    void testFieldDeserialization() {
        State state = Jsons.fromJson(
                "{\"owner\":\"bob\",\"openedAt\":\"2025-01-01T00:00:00Z\",\"extra\":1}", State.class);

        assertThat(state.owner).isEqualTo("bob");
        assertThat(state.openedAt).isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("fromJson - invalid JSON should be a permanent failure")
    void testInvalidJson() {
        assertThatThrownBy(() -> Jsons.fromJson("{not json", State.class))
                .isInstanceOf(PermanentException.class);
    }

    @Test
    @DisplayName("toMap - blank input should give an empty map")
    void testToMap() {
        assertThat(Jsons.toMap(" ")).isEmpty();
        Map<String, Object> map = Jsons.toMap("{\"balance\":42}");
        assertThat(map).containsEntry("balance", 42);
    }
}
