package com.example.gateway.shared.config;

import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;

/**
 * Tags every request with a correlation id: the caller's {@value #CORRELATION_ID_HEADER} when it
 * is usable, a fresh UUID otherwise. The id is echoed on the response and stored in the Reactor
 * context.
 *
 * <p>The MDC entry only lives while the request pipeline is being subscribed, so it never leaks
 * into the next request served by the same event loop thread. Tasks handed to a Reactor
 * scheduler during that window carry it along through {@link MdcScheduleHook}.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_KEY = "correlation_id";

    static final int MAX_LENGTH = 128;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String correlationId = resolve(exchange.getRequest().getHeaders().getFirst(CORRELATION_ID_HEADER));
        exchange.getAttributes().put(CORRELATION_ID_KEY, correlationId);
        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        Mono<Void> filtered = chain.filter(exchange)
                .contextWrite(Context.of(CORRELATION_ID_KEY, correlationId));
        return Mono.from(subscriber -> {
            try (MDC.MDCCloseable ignored = MDC.putCloseable(CORRELATION_ID_KEY, correlationId)) {
                filtered.subscribe(subscriber);
            }
        });
    }

    /**
     * Blank, oversized or non-printable ids are replaced rather than copied into logs.
     */
    static String resolve(String incoming) {
        if (incoming == null || incoming.isBlank() || incoming.length() > MAX_LENGTH
                || !incoming.chars().allMatch(c -> c > 0x20 && c < 0x7f)) {
            return UUID.randomUUID().toString();
        }
        return incoming;
    }
}
