package com.example.gateway.session.media;

import com.example.gateway.shared.aspect.Monitored;
import com.example.gateway.shared.config.AppProperties;
import com.example.gateway.shared.config.MonitoringConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Attachment store shared by all tenants, bounded by entry count and per-entry age.
 *
 * <p>Eviction is strict least-recently-used: both {@link #put} and a successful {@link #get}
 * make an entry the most recent one, so a just-inserted or just-read entry is never the one
 * evicted. Expired entries are dropped lazily on lookup and by a periodic sweep.</p>
 */
@Component
@Slf4j
public class MediaCache {

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<MediaKey, MediaItem> entries;
    // contentHash -> number of keys holding that content
    private final Map<String, Integer> contentRefs = new HashMap<>();

    private final int capacity;
    private final Duration ttl;
    private final Clock clock;
    private final MonitoringConfig.GatewayMetricsCollector metricsCollector;

    @Autowired
    public MediaCache(AppProperties appProperties, Clock clock, MonitoringConfig.GatewayMetricsCollector metricsCollector) {
        this(appProperties.getMedia().getCapacity(), Duration.ofMillis(appProperties.getMedia().getTtl()), clock, metricsCollector);
    }

    MediaCache(int capacity, Duration ttl, Clock clock, MonitoringConfig.GatewayMetricsCollector metricsCollector) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.ttl = ttl;
        this.clock = clock;
        this.metricsCollector = metricsCollector;
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    public void put(MediaKey key, MediaItem item) {
        lock.lock();
        try {
            MediaItem previous = entries.remove(key);
            if (previous != null) {
                releaseContent(previous);
            } else if (entries.size() >= capacity) {
                evictEldest();
            }
            entries.put(key, item);
            int refs = contentRefs.merge(item.contentHash(), 1, Integer::sum);
            if (refs > 1) {
                log.debug("Media {} has the same content as {} other cached item(s) (hash {})",
                        key, refs - 1, item.contentHash());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the item, or empty when it was never cached, was evicted or has expired
     */
    public Optional<MediaItem> get(MediaKey key) {
        lock.lock();
        try {
            MediaItem item = entries.get(key);
            if (item == null) {
                return Optional.empty();
            }
            if (isExpired(item, clock.instant())) {
                entries.remove(key);
                releaseContent(item);
                metricsCollector.incrementCounter("gateway.media.evicted", "cause", "expired");
                return Optional.empty();
            }
            return Optional.of(item);
        } finally {
            lock.unlock();
        }
    }

    @Scheduled(fixedDelayString = "${gateway.media.sweep-interval:60000}")
    @Monitored("scheduler")
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        lock.lock();
        try {
            Iterator<MediaItem> iterator = entries.values().iterator();
            while (iterator.hasNext()) {
                MediaItem item = iterator.next();
                if (isExpired(item, now)) {
                    iterator.remove();
                    releaseContent(item);
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            for (int i = 0; i < removed; i++) {
                metricsCollector.incrementCounter("gateway.media.evicted", "cause", "expired");
            }
            log.debug("Purged {} expired media item(s)", removed);
        }
        return removed;
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int distinctContents() {
        lock.lock();
        try {
            return contentRefs.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    private void evictEldest() {
        Iterator<Map.Entry<MediaKey, MediaItem>> iterator = entries.entrySet().iterator();
        if (iterator.hasNext()) {
            Map.Entry<MediaKey, MediaItem> eldest = iterator.next();
            iterator.remove();
            releaseContent(eldest.getValue());
            metricsCollector.incrementCounter("gateway.media.evicted", "cause", "capacity");
            log.debug("Media {} evicted at capacity {}", eldest.getKey(), capacity);
        }
    }

    private void releaseContent(MediaItem item) {
        contentRefs.computeIfPresent(item.contentHash(), (hash, refs) -> refs > 1 ? refs - 1 : null);
    }

    private boolean isExpired(MediaItem item, Instant now) {
        return !now.isBefore(item.capturedAt().plus(ttl));
    }
}
