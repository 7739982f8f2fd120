package com.acme.cqrs.store;

import com.acme.cqrs.core.ConcurrencyConflictException;
import com.acme.cqrs.spi.EventStore;
import com.acme.cqrs.support.MoneyDeposited;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InMemoryEventStoreTest {

    private final InMemoryEventStore store = new InMemoryEventStore();

    private static MoneyDeposited event(String id, long version) {
        return new MoneyDeposited(id, version, "tenant-1", 1);
    }

    @Test
    @DisplayName("append - should accept contiguous events at the expected version")
    void testAppend() {
        store.append("acc-1", 0, List.of(event("acc-1", 1), event("acc-1", 2)));
        store.append("acc-1", 2, List.of(event("acc-1", 3)));

        assertThat(store.readVersion("acc-1")).isEqualTo(3);
        assertThat(store.readEvents("acc-1")).hasSize(3);
    }

    @Test
    @DisplayName("append - wrong expected version should conflict and leave the stream untouched")
    void testExpectedVersionMismatch() {
        store.append("acc-1", 0, List.of(event("acc-1", 1)));

        assertThatThrownBy(() -> store.append("acc-1", 0, List.of(event("acc-1", 1))))
                .isInstanceOf(ConcurrencyConflictException.class);
        assertThat(store.readVersion("acc-1")).isEqualTo(1);
    }

    @Test
    @DisplayName("append - any version should still require contiguous events")
    void testAnyVersion() {
        store.append("acc-1", EventStore.ANY_VERSION, List.of(event("acc-1", 1)));

        assertThatThrownBy(() -> store.append("acc-1", EventStore.ANY_VERSION, List.of(event("acc-1", 3))))
                .isInstanceOf(ConcurrencyConflictException.class);
    }

    @Test
    @DisplayName("readEvents - bounds should be inclusive and optional")
    void testReadRange() {
        store.append("acc-1", 0, List.of(event("acc-1", 1), event("acc-1", 2), event("acc-1", 3)));

        assertThat(store.readEvents("acc-1", 2L, null)).hasSize(2);
        assertThat(store.readEvents("acc-1", null, 1L)).hasSize(1);
        assertThat(store.readEvents("unknown")).isEmpty();
        assertThat(store.readVersion("unknown")).isZero();
    }

    @Test
    @DisplayName("deleteAll - should count only existing streams")
    void testDeleteAll() {
        store.append("acc-1", 0, List.of(event("acc-1", 1)));
        store.append("acc-2", 0, List.of(event("acc-2", 1)));

        assertThat(store.deleteAll(List.of("acc-1", "acc-2", "acc-3"))).isEqualTo(2);
        assertThat(store.delete("acc-1")).isFalse();
    }
}
