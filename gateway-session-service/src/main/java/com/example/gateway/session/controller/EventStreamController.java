package com.example.gateway.session.controller;

import com.example.gateway.session.sse.StreamingSubscriberManager;
import com.example.gateway.shared.exception.RateLimitedException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;

@RestController
@RequiredArgsConstructor
@Slf4j
public class EventStreamController {

    private final StreamingSubscriberManager subscriberManager;

    /**
     * Streams the tenant's events. The first event is always its current {@code status}.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @RateLimiter(name = "eventStreamLimiter", fallbackMethod = "connectFallback")
    public Flux<ServerSentEvent<String>> events(@RequestParam(name = "tenant", required = false) String tenant,
                                                ServerWebExchange exchange) {
        String tenantId = TenantIds.requireValid(tenant);
        log.info("Event stream requested for tenant {} from {}", tenantId,
                exchange.getRequest().getRemoteAddress() != null
                        ? exchange.getRequest().getRemoteAddress().getAddress().getHostAddress()
                        : "unknown");
        return subscriberManager.createEventStream(tenantId);
    }

    public Flux<ServerSentEvent<String>> connectFallback(String tenant, ServerWebExchange exchange, RequestNotPermitted ex) {
        log.warn("Event stream rate limit exceeded for tenant {}. IP: {}. Details: {}",
                tenant, exchange.getRequest().getRemoteAddress(), ex.getMessage());
        return Flux.error(new RateLimitedException("Event stream rate limit exceeded. Please try again later."));
    }
}
