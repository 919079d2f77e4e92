package com.example.gateway.session.health;

import com.example.gateway.session.media.MediaCache;
import com.example.gateway.session.model.SessionSnapshot;
import com.example.gateway.session.registry.SessionRegistry;
import com.example.gateway.session.sse.StreamingSubscriberManager;
import com.example.gateway.shared.config.AppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Sessions per status, open push subscribers and media cache fill, reported under the name of
 * this gateway instance. Individual tenant failures never make the gateway itself DOWN.
 */
@Component
@RequiredArgsConstructor
public class GatewayHealthIndicator implements HealthIndicator {

    private final SessionRegistry sessionRegistry;
    private final StreamingSubscriberManager subscriberManager;
    private final MediaCache mediaCache;
    private final AppProperties appProperties;

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        if (appProperties.getInstanceName() != null) {
            details.put("instance", appProperties.getInstanceName());
        }

        boolean sessionsHealthy = checkSessions(details);
        boolean cacheHealthy = checkMediaCache(details);
        details.put("subscribers", subscriberManager.subscriberCount());

        Health.Builder builder = sessionsHealthy && cacheHealthy ? Health.up() : Health.down();
        return builder.withDetails(details).build();
    }

    private boolean checkSessions(Map<String, Object> details) {
        try {
            List<SessionSnapshot> sessions = sessionRegistry.list();
            Map<String, Long> byStatus = sessions.stream()
                    .collect(Collectors.groupingBy(s -> s.status().wireName(), TreeMap::new, Collectors.counting()));
            details.put("sessions", sessions.size());
            details.put("sessionsByStatus", byStatus);
            return true;
        } catch (RuntimeException e) {
            details.put("sessionsError", e.getMessage());
            return false;
        }
    }

    private boolean checkMediaCache(Map<String, Object> details) {
        try {
            Map<String, Object> cache = new HashMap<>();
            cache.put("size", mediaCache.size());
            cache.put("capacity", mediaCache.capacity());
            cache.put("distinctContents", mediaCache.distinctContents());
            details.put("mediaCache", cache);
            return true;
        } catch (RuntimeException e) {
            details.put("mediaCacheError", e.getMessage());
            return false;
        }
    }
}
