package com.acme.cqrs.runtime;

import com.acme.cqrs.bus.CqrsBus;
import com.acme.cqrs.command.CommandBus;
import com.acme.cqrs.config.CqrsConfig;
import com.acme.cqrs.config.RepositoryConfig;
import com.acme.cqrs.event.EventBus;
import com.acme.cqrs.query.QueryBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CQRS Bean Factory Tests")
class CqrsBeansFactoryTest {

    private CqrsBeansFactory factory;
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        factory = new CqrsBeansFactory();
    }

    @AfterEach
    void tearDown() {
        if (eventBus != null) {
            eventBus.close();
        }
    }

    @Nested
    @DisplayName("Configuration Beans")
    class ConfigurationTests {

        @Test
        @DisplayName("Should create CqrsConfig bean with default values")
        void shouldCreateCqrsConfig() {
            CqrsConfig config = factory.cqrsConfig();

            assertThat(config.isEnabled()).isTrue();
            assertThat(config.getCommandTimeout()).isEqualTo(Duration.ofSeconds(30));
            assertThat(config.getQueryTimeout()).isEqualTo(Duration.ofSeconds(30));
            assertThat(config.isQueryCacheEnabled()).isTrue();
            assertThat(config.getMaxConcurrency()).isEqualTo(10);
        }

        @Test
        @DisplayName("Should create RepositoryConfig bean with default values")
        void shouldCreateRepositoryConfig() {
            RepositoryConfig config = factory.repositoryConfig();

            assertThat(config.isEventStoreEnabled()).isTrue();
            assertThat(config.getSnapshotInterval()).isEqualTo(10);
            assertThat(config.getMaxRetries()).isEqualTo(3);
            assertThat(config.getRetryDelay()).isEqualTo(Duration.ofSeconds(1));
            assertThat(config.getCacheTtl()).isEqualTo(Duration.ofMinutes(5));
        }
    }

    @Nested
    @DisplayName("Facade Wiring")
    class FacadeTests {

        @Test
        @DisplayName("Should wire the facade over the created buses")
        void shouldWireFacade() {
            CqrsConfig config = factory.cqrsConfig();
            CommandBus commandBus = factory.commandBus(config);
            QueryBus queryBus = factory.queryBus(config);
            eventBus = factory.eventBus(config);

            CqrsBus bus = factory.cqrsBus(commandBus, queryBus, eventBus,
                    factory.projectorManager(), factory.useCaseRegistry(), config);

            assertThat(bus.getCommandBus()).isSameAs(commandBus);
            assertThat(bus.getQueryBus()).isSameAs(queryBus);
            assertThat(bus.getEventBus()).isSameAs(eventBus);
            assertThat(bus.isInitialized()).isFalse();
        }

        @Test
        @DisplayName("Should provide empty in-memory stores")
        void shouldProvideInMemoryStores() {
            assertThat(factory.inMemoryEventStore().readVersion("any")).isZero();
            assertThat(factory.inMemorySnapshotStore().get("any")).isEmpty();
            assertThat(factory.cache().size()).isZero();
        }
    }
}
