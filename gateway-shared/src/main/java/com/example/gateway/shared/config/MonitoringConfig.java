package com.example.gateway.shared.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the session gateway.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    /**
     * Pre-registers the fixed meters so dashboards see zeroes before the first event.
     */
    @Bean
    public MeterBinder gatewayMetrics() {
        return new MeterBinder() {
            @Override
            public void bindTo(MeterRegistry registry) {
                registry.counter("gateway.webhook.deliveries", "status", "success");
                registry.counter("gateway.webhook.deliveries", "status", "failed");

                registry.counter("gateway.media.captured", "status", "success");
                registry.counter("gateway.media.captured", "status", "failed");
                registry.counter("gateway.media.evicted", "cause", "capacity");
                registry.counter("gateway.media.evicted", "cause", "expired");

                registry.counter("gateway.reconnect", "outcome", "scheduled");
                registry.counter("gateway.reconnect", "outcome", "dropped");
                registry.counter("gateway.reconnect", "outcome", "exhausted");

                Timer.builder("gateway.webhook.latency")
                        .description("Time taken to POST one webhook")
                        .register(registry);
            }
        };
    }

    @Bean
    public GatewayMetricsCollector gatewayMetricsCollector(MeterRegistry registry) {
        return new GatewayMetricsCollector(registry);
    }

    /**
     * Lazily creates and caches meters by name and tags.
     */
    public static class GatewayMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

        public GatewayMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            counters.computeIfAbsent(key, k -> registry.counter(name, tags)).increment();
        }

        public void recordTimer(String name, long duration, String... tags) {
            String key = name + "_" + String.join("_", tags);
            timers.computeIfAbsent(key, k ->
                    Timer.builder(name).tags(tags).register(registry))
                    .record(duration, TimeUnit.MILLISECONDS);
        }

        public void setGauge(String name, double value, String... tags) {
            String key = name + "_" + String.join("_", tags);
            AtomicLong gauge = gauges.computeIfAbsent(key, k -> {
                AtomicLong newGauge = new AtomicLong();
                registry.gauge(name, Tags.of(tags), newGauge);
                return newGauge;
            });
            gauge.set((long) value);
        }
    }
}
