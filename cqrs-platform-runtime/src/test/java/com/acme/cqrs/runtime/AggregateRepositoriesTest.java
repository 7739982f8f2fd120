package com.acme.cqrs.runtime;

import com.acme.cqrs.aggregate.AggregateRepository;
import com.acme.cqrs.aggregate.AggregateRoot;
import com.acme.cqrs.bus.CqrsBus;
import com.acme.cqrs.config.CqrsConfig;
import com.acme.cqrs.config.RepositoryConfig;
import com.acme.cqrs.core.Jsons;
import com.acme.cqrs.event.EventBus;
import com.acme.cqrs.message.DomainEvent;
import com.acme.cqrs.projection.DefaultProjectorManager;
import com.acme.cqrs.projection.EventProjector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

/**
 * Wires the beans the way the context does and checks that committed events travel from the
 * repository through the facade to subscribers and projectors.
 */
class AggregateRepositoriesTest {

    private EventBus eventBus;
    private CqrsBus cqrsBus;
    private DefaultProjectorManager projectorManager;
    private AggregateRepositories repositories;

    @BeforeEach
    void setUp() {
        CqrsBeansFactory factory = new CqrsBeansFactory();
        CqrsConfig config = factory.cqrsConfig();
        eventBus = factory.eventBus(config);
        projectorManager = factory.projectorManager();
        cqrsBus = factory.cqrsBus(factory.commandBus(config), factory.queryBus(config), eventBus,
                projectorManager, factory.useCaseRegistry(), config);
        RepositoryConfig repositoryConfig = factory.repositoryConfig();
        repositories = new AggregateRepositories(factory.inMemoryEventStore(),
                factory.inMemorySnapshotStore(), factory.cache(), cqrsBus, repositoryConfig);
        new CqrsLifecycle(cqrsBus, config, repositoryConfig).onStartup(null);
    }

    @AfterEach
    void tearDown() {
        eventBus.close();
    }

    @Test
    @DisplayName("create - should publish saved events to subscribers and projectors")
    void testSavedEventsReachReadSide() {
        List<DomainEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribe(Incremented.TYPE, received::add);
        Map<String, Integer> readModel = new ConcurrentHashMap<>();
        projectorManager.register(new CounterProjector(readModel));

        AggregateRepository<Counter> repository = repositories.create("Counter", Counter::new);
        Counter counter = new Counter("counter-1");
        counter.increment();
        counter.increment();
        repository.save(counter);

        assertThat(received).hasSize(2);
        assertThat(readModel).containsEntry("counter-1", 2);
        assertThat(repository.findById("counter-1").getValue()).isEqualTo(2);
        assertThat(cqrsBus.getStatistics().events().published()).isEqualTo(2);
    }

    static final class Incremented extends DomainEvent {
        static final String TYPE = "Incremented";

        Incremented(String counterId, long version) {
            super(counterId, version, "tenant-1");
        }

        @Override
        public String eventType() {
            return TYPE;
        }
    }

    static final class Counter extends AggregateRoot {
        private int value;

        Counter(String id) {
            super(id);
        }

        void increment() {
            raise(new Incremented(getId(), nextVersion()));
        }

        int getValue() {
            return value;
        }

        @Override
        protected void apply(DomainEvent event) {
            value++;
        }

        @Override
        protected Object captureState() {
            return Map.of("value", value);
        }

        @Override
        protected void restoreState(String stateJson) {
            value = ((Number) Jsons.toMap(stateJson).get("value")).intValue();
        }
    }

    private static final class CounterProjector implements EventProjector<Incremented> {
        private final Map<String, Integer> readModel;

        CounterProjector(Map<String, Integer> readModel) {
            this.readModel = readModel;
        }

        @Override
        public void project(Incremented event) {
            readModel.merge(event.getAggregateId(), 1, Integer::sum);
        }

        @Override
        public String getProjectorName() {
            return "counter-totals";
        }

        @Override
        public List<String> getProjectedEventTypes() {
            return List.of(Incremented.TYPE);
        }
    }
}
