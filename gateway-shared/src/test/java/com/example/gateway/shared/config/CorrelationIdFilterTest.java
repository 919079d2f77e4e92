package com.example.gateway.shared.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();
    private final Scheduler io = Schedulers.newBoundedElastic(2, 100, "correlation-test-io");

    @BeforeEach
    void installHook() {
        Schedulers.onScheduleHook(MdcScheduleHook.KEY, MdcScheduleHook::decorate);
    }

    @AfterEach
    void tearDown() {
        Schedulers.resetOnScheduleHook(MdcScheduleHook.KEY);
        io.dispose();
        MDC.clear();
    }

    @Test
    void callerIdIsEchoedAndVisibleToTheHandler() {
        AtomicReference<String> inMdc = new AtomicReference<>();
        AtomicReference<String> inContext = new AtomicReference<>();
        WebFilterChain chain = exchange -> Mono.deferContextual(context -> {
            inMdc.set(MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY));
            inContext.set(context.get(CorrelationIdFilter.CORRELATION_ID_KEY));
            return Mono.empty();
        });
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/sessions")
                .header(CorrelationIdFilter.CORRELATION_ID_HEADER, "req-42"));

        filter.filter(exchange, chain).block();

        assertThat(exchange.getResponse().getHeaders().getFirst(CorrelationIdFilter.CORRELATION_ID_HEADER)).isEqualTo("req-42");
        assertThat(inMdc.get()).isEqualTo("req-42");
        assertThat(inContext.get()).isEqualTo("req-42");
        assertThat(MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY)).isNull();
    }

    @Test
    void workOnTheIoSchedulerCarriesTheId() {
        AtomicReference<String> onWorker = new AtomicReference<>();
        AtomicReference<String> workerThread = new AtomicReference<>();
        WebFilterChain chain = exchange -> Mono.fromRunnable(() -> {
                    onWorker.set(MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY));
                    workerThread.set(Thread.currentThread().getName());
                })
                .subscribeOn(io)
                .then();
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/sessions/t1/start")
                .header(CorrelationIdFilter.CORRELATION_ID_HEADER, "req-43"));

        filter.filter(exchange, chain).block();

        assertThat(workerThread.get()).startsWith("correlation-test-io");
        assertThat(onWorker.get()).isEqualTo("req-43");
    }

    @Test
    void missingOrUnusableIdsAreReplaced() {
        assertThat(CorrelationIdFilter.resolve(null)).hasSize(36);
        assertThat(CorrelationIdFilter.resolve("  ")).hasSize(36);
        assertThat(CorrelationIdFilter.resolve("a\nforged log line")).isNotEqualTo("a\nforged log line");
        assertThat(CorrelationIdFilter.resolve("x".repeat(CorrelationIdFilter.MAX_LENGTH + 1))).hasSize(36);
        assertThat(CorrelationIdFilter.resolve("abc-123")).isEqualTo("abc-123");
    }

    @Test
    void hookLeavesTasksWithoutMdcUntouched() {
        Runnable task = () -> { };

        assertThat(MdcScheduleHook.decorate(task)).isSameAs(task);
    }
}
