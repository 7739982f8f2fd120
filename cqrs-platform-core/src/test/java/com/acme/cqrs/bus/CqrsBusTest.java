package com.acme.cqrs.bus;

import com.acme.cqrs.command.CommandBus;
import com.acme.cqrs.command.CommandHandler;
import com.acme.cqrs.config.CqrsConfig;
import com.acme.cqrs.core.AlreadyInitializedException;
import com.acme.cqrs.core.NotInitializedException;
import com.acme.cqrs.core.UseCaseNotFoundException;
import com.acme.cqrs.event.AbstractEventHandler;
import com.acme.cqrs.event.EventBus;
import com.acme.cqrs.message.DomainEvent;
import com.acme.cqrs.message.QueryResult;
import com.acme.cqrs.middleware.LoggingMiddleware;
import com.acme.cqrs.projection.ProjectorManager;
import com.acme.cqrs.query.QueryBus;
import com.acme.cqrs.query.QueryHandler;
import com.acme.cqrs.support.DepositMoney;
import com.acme.cqrs.support.GetBalance;
import com.acme.cqrs.support.MoneyDeposited;
import com.acme.cqrs.usecase.InMemoryUseCaseRegistry;
import com.acme.cqrs.usecase.UseCase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CqrsBusTest {

    @Mock
    private ProjectorManager projectorManager;

    private EventBus eventBus;
    private InMemoryUseCaseRegistry useCases;
    private CqrsBus cqrs;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        useCases = new InMemoryUseCaseRegistry();
        cqrs = new CqrsBus(
                new CommandBus(), new QueryBus(), eventBus, projectorManager, useCases, new CqrsConfig());
    }

    @AfterEach
    void tearDown() {
        eventBus.close();
    }

    static class NoopDepositHandler implements CommandHandler<DepositMoney> {
        int executed;

        @Override
        public void execute(DepositMoney command) {
            executed++;
        }

        @Override
        public boolean supports(String commandType) {
            return DepositMoney.TYPE.equals(commandType);
        }
    }

    static class FixedBalanceHandler implements QueryHandler<GetBalance, QueryResult<Long>> {
        @Override
        public QueryResult<Long> execute(GetBalance query) {
            return QueryResult.single(42L);
        }

        @Override
        public boolean supports(String queryType) {
            return GetBalance.TYPE.equals(queryType);
        }

        @Override
        public Duration getCacheExpiration(GetBalance query) {
            return Duration.ofMinutes(1);
        }
    }

    static class CollectingHandler extends AbstractEventHandler<MoneyDeposited> {
        final List<DomainEvent> received = new CopyOnWriteArrayList<>();

        CollectingHandler() {
            super(MoneyDeposited.TYPE);
        }

        @Override
        public void handle(MoneyDeposited event) {
            received.add(event);
        }
    }

    @Nested
    @DisplayName("Lifecycle Tests")
    class LifecycleTests {

        @Test
        @DisplayName("executeCommand - should fail before initialize")
        void testNotInitialized() {
            assertThatThrownBy(() -> cqrs.executeCommand(new DepositMoney("acc-1", 5)))
                    .isInstanceOf(NotInitializedException.class);
            assertThatThrownBy(() -> cqrs.executeQuery(new GetBalance("acc-1")))
                    .isInstanceOf(NotInitializedException.class);
            assertThatThrownBy(() -> cqrs.publishEvent(new MoneyDeposited("acc-1", 1, "tenant-1", 5)))
                    .isInstanceOf(NotInitializedException.class);
        }

        @Test
        @DisplayName("initialize - second call should fail")
        void testInitializeTwice() {
            cqrs.initialize();

            assertThatThrownBy(() -> cqrs.initialize())
                    .isInstanceOf(AlreadyInitializedException.class);
            assertThat(cqrs.getState()).isEqualTo(CqrsBus.State.INITIALIZED);
        }

        @Test
        @DisplayName("shutdown - should fail when not initialized")
        void testShutdownNotInitialized() {
            assertThatThrownBy(() -> cqrs.shutdown()).isInstanceOf(NotInitializedException.class);
        }

        @Test
        @DisplayName("shutdown - should clear handlers, subscriptions, middlewares and caches")
        void testShutdownClearsEverything() {
            cqrs.initialize();
            cqrs.getCommandBus().registerHandler(DepositMoney.TYPE, new NoopDepositHandler());
            cqrs.getQueryBus().registerHandler(GetBalance.TYPE, new FixedBalanceHandler());
            cqrs.getEventBus().registerHandler(MoneyDeposited.TYPE, new CollectingHandler());
            cqrs.getEventBus().subscribe("AccountClosed", event -> { });
            cqrs.getCommandBus().addMiddleware(new LoggingMiddleware());
            cqrs.executeQuery(new GetBalance("acc-1"));

            cqrs.shutdown();

            assertThat(cqrs.supportsCommand(DepositMoney.TYPE)).isFalse();
            assertThat(cqrs.supportsQuery(GetBalance.TYPE)).isFalse();
            assertThat(cqrs.supportsEvent(MoneyDeposited.TYPE)).isFalse();
            assertThat(cqrs.supportsEvent("AccountClosed")).isFalse();
            CqrsStatistics stats = cqrs.getStatistics();
            assertThat(stats.initialized()).isFalse();
            assertThat(stats.totalHandlers()).isZero();
            assertThat(stats.totalMiddlewares()).isZero();
            assertThat(stats.queryCache().totalEntries()).isZero();
        }

        @Test
        @DisplayName("initialize - should be possible again after shutdown")
        void testReinitialize() {
            cqrs.initialize();
            cqrs.shutdown();

            assertThatCode(() -> cqrs.initialize()).doesNotThrowAnyException();
            assertThat(cqrs.isInitialized()).isTrue();
        }

        @Test
        @DisplayName("healthCheck - should reflect initialization")
        void testHealthCheck() {
            assertThat(cqrs.healthCheck()).isFalse();

            cqrs.initialize();

            assertThat(cqrs.healthCheck()).isTrue();
        }
    }

    @Nested
    @DisplayName("Dispatch Tests")
    class DispatchTests {

        @BeforeEach
        void initialize() {
            cqrs.initialize();
        }

        @Test
        @DisplayName("executeCommand - should reach the command handler")
        void testExecuteCommand() {
            NoopDepositHandler handler = new NoopDepositHandler();
            cqrs.getCommandBus().registerHandler(DepositMoney.TYPE, handler);

            cqrs.executeCommand(new DepositMoney("acc-1", 5));

            assertThat(handler.executed).isEqualTo(1);
        }

        @Test
        @DisplayName("executeQuery - should return the query result")
        void testExecuteQuery() {
            cqrs.getQueryBus().registerHandler(GetBalance.TYPE, new FixedBalanceHandler());

            QueryResult<Long> result = cqrs.executeQuery(new GetBalance("acc-1"));

            assertThat(result.first()).contains(42L);
        }

        @Test
        @DisplayName("publishEvent - should deliver to handlers and then project")
        void testPublishEventProjects() {
            CollectingHandler handler = new CollectingHandler();
            cqrs.getEventBus().registerHandler(MoneyDeposited.TYPE, handler);
            MoneyDeposited event = new MoneyDeposited("acc-1", 1, "tenant-1", 5);

            cqrs.publishEvent(event);

            assertThat(handler.received).containsExactly(event);
            verify(projectorManager).projectEvent(event);
        }

        @Test
        @DisplayName("publishEvent - projection failure should not reach the caller")
        void testProjectionFailureSwallowedFromCaller() {
            doThrow(new IllegalStateException("projection down"))
                    .when(projectorManager).projectEvent(any());

            assertThatCode(() -> cqrs.publishEvent(new MoneyDeposited("acc-1", 1, "tenant-1", 5)))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("publishEvents - should publish the batch and project it")
        void testPublishEvents() {
            CollectingHandler handler = new CollectingHandler();
            cqrs.getEventBus().registerHandler(MoneyDeposited.TYPE, handler);
            List<MoneyDeposited> events = List.of(
                    new MoneyDeposited("acc-1", 1, "tenant-1", 5),
                    new MoneyDeposited("acc-1", 2, "tenant-1", 7));

            cqrs.publishEvents(events);

            assertThat(handler.received).hasSize(2);
            verify(projectorManager).projectEvents(events);
        }

        @Test
        @DisplayName("executeUseCase - should run the named use case")
        void testExecuteUseCase() {
            useCases.register("double", (UseCase<Integer, Integer>) n -> n * 2);

            Integer result = cqrs.executeUseCase("double", 21);

            assertThat(result).isEqualTo(42);
        }

        @Test
        @DisplayName("executeUseCase - unknown name should fail")
        void testUnknownUseCase() {
            assertThatThrownBy(() -> cqrs.executeUseCase("missing", "request"))
                    .isInstanceOf(UseCaseNotFoundException.class)
                    .hasMessageContaining("missing");
        }

        @Test
        @DisplayName("getStatistics - should aggregate counts across buses")
        void testStatistics() {
            cqrs.getCommandBus().registerHandler(DepositMoney.TYPE, new NoopDepositHandler());
            cqrs.getQueryBus().registerHandler(GetBalance.TYPE, new FixedBalanceHandler());
            cqrs.getEventBus().registerHandler(MoneyDeposited.TYPE, new CollectingHandler());
            cqrs.getEventBus().registerHandler(MoneyDeposited.TYPE, new CollectingHandler());
            cqrs.getQueryBus().addMiddleware(new LoggingMiddleware());

            CqrsStatistics stats = cqrs.getStatistics();

            assertThat(stats.initialized()).isTrue();
            assertThat(stats.commandHandlers()).isEqualTo(1);
            assertThat(stats.queryHandlers()).isEqualTo(1);
            assertThat(stats.eventHandlers()).isEqualTo(2);
            assertThat(stats.totalHandlers()).isEqualTo(4);
            assertThat(stats.queryMiddlewares()).isEqualTo(1);
            assertThat(cqrs.getSupportedEventTypes()).containsExactly(MoneyDeposited.TYPE);
        }
    }
}
