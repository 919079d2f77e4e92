package com.example.gateway.session.webhook;

import com.example.gateway.session.event.GatewayEvent;
import com.example.gateway.shared.config.AppProperties;
import com.example.gateway.shared.config.MonitoringConfig;
import com.example.gateway.shared.exception.WebhookDeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

/**
 * Forwards events to the tenant's webhook. Each event is POSTed at most once; failures are
 * logged and counted, never retried and never reported back to the publisher.
 */
@Component
@Slf4j
public class WebhookDispatcher {

    static final String SECRET_HEADER = "x-webhook-secret";

    private final WebhookRegistry webhookRegistry;
    private final WebClient webClient;
    private final MonitoringConfig.GatewayMetricsCollector metricsCollector;
    private final Duration timeout;

    public WebhookDispatcher(WebhookRegistry webhookRegistry,
                             @Qualifier("webhookWebClient") WebClient webClient,
                             MonitoringConfig.GatewayMetricsCollector metricsCollector,
                             AppProperties appProperties) {
        this.webhookRegistry = webhookRegistry;
        this.webClient = webClient;
        this.metricsCollector = metricsCollector;
        this.timeout = Duration.ofMillis(appProperties.getWebhook().getTimeout());
    }

    /**
     * Schedules the POST and returns immediately.
     */
    public void deliver(GatewayEvent event) {
        Optional<WebhookConfig> config = webhookRegistry.find(event.tenantId());
        if (config.isEmpty() || !config.get().accepts(event.kind())) {
            return;
        }
        post(config.get(), event).subscribe();
    }

    /**
     * Completes empty whether or not the POST succeeded. The URL is taken literally, never as a
     * URI template, and a malformed one fails the returned Mono rather than the caller.
     */
    Mono<Void> post(WebhookConfig config, GatewayEvent event) {
        long started = System.currentTimeMillis();
        return Mono.defer(() -> webClient.post()
                .uri(URI.create(config.url()))
                .contentType(MediaType.APPLICATION_JSON)
                .headers(headers -> {
                    if (config.hasSecret()) {
                        headers.set(SECRET_HEADER, config.secret());
                    }
                })
                .bodyValue(WebhookEnvelope.from(event))
                .retrieve()
                .toBodilessEntity())
                .timeout(timeout)
                .doOnSuccess(response -> {
                    metricsCollector.incrementCounter("gateway.webhook.deliveries", "status", "success");
                    metricsCollector.recordTimer("gateway.webhook.latency", System.currentTimeMillis() - started);
                    log.debug("Webhook {} delivered for tenant {} to {}",
                            event.kind().wireName(), event.tenantId(), config.url());
                })
                .onErrorResume(e -> {
                    WebhookDeliveryException failure = new WebhookDeliveryException(
                            "Webhook " + event.kind().wireName() + " for tenant " + event.tenantId()
                                    + " to " + config.url() + " failed", e);
                    metricsCollector.incrementCounter("gateway.webhook.deliveries", "status", "failed");
                    log.warn("{}: {}", failure.getMessage(), e.toString());
                    return Mono.empty();
                })
                .then();
    }
}
