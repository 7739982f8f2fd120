package com.acme.cqrs.middleware;

import com.acme.cqrs.message.MessageContext;
import com.acme.cqrs.support.DepositMoney;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class LoggingMiddlewareTest {

    private final LoggingMiddleware middleware = new LoggingMiddleware();

    @Test
    @DisplayName("execute - should expose message identity in MDC during dispatch only")
    void testMdcPopulated() {
        DepositMoney command = new DepositMoney("acc-1", 10);
        MessageContext context = MessageContext.of(command, null);
        Map<String, String> seen = new HashMap<>();

        Object result = middleware.execute(context, () -> {
            seen.put("id", MDC.get(LoggingMiddleware.MDC_MESSAGE_ID));
            seen.put("type", MDC.get(LoggingMiddleware.MDC_MESSAGE_TYPE));
            seen.put("tenant", MDC.get(LoggingMiddleware.MDC_TENANT_ID));
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(seen)
                .containsEntry("id", command.getMessageId().toString())
                .containsEntry("type", DepositMoney.TYPE)
                .containsEntry("tenant", "tenant-1");
        assertThat(MDC.get(LoggingMiddleware.MDC_MESSAGE_ID)).isNull();
    }

    @Test
    @DisplayName("execute - should rethrow failures unchanged and clear MDC")
    void testRethrows() {
        MessageContext context = MessageContext.of(new DepositMoney("acc-1", 10), null);
        IllegalStateException failure = new IllegalStateException("boom");

        assertThatThrownBy(() -> middleware.execute(context, () -> {
            throw failure;
        })).isSameAs(failure);
        assertThat(MDC.get(LoggingMiddleware.MDC_TENANT_ID)).isNull();
    }

    @Test
    @DisplayName("getName - should use the fixed name so re-adding replaces it")
    void testName() {
        assertThat(new LoggingMiddleware(5).getName()).isEqualTo(LoggingMiddleware.NAME);
        assertThat(new LoggingMiddleware(5).getPriority()).isEqualTo(5);
    }
}
