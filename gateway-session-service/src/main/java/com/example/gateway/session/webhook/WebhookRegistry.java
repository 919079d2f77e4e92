package com.example.gateway.session.webhook;

import com.example.gateway.session.event.EventKind;
import com.example.gateway.shared.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Webhook configuration per tenant. Survives session restarts; replaced whenever a start
 * request names a URL.
 */
@Component
@Slf4j
public class WebhookRegistry {

    private final Map<String, WebhookConfig> configs = new ConcurrentHashMap<>();

    /**
     * A null URL keeps the current configuration; a blank one removes it.
     *
     * @throws ValidationException when the URL is not an absolute http(s) URI
     */
    public void update(String tenantId, String url, String secret, Set<EventKind> events) {
        if (url == null) {
            return;
        }
        if (url.isBlank()) {
            if (configs.remove(tenantId) != null) {
                log.info("Webhook removed for tenant {}", tenantId);
            }
            return;
        }
        String target = url.trim();
        validate(target);
        WebhookConfig config = new WebhookConfig(target, secret, events);
        configs.put(tenantId, config);
        log.info("Webhook configured for tenant {}: {}", tenantId, config);
    }

    static void validate(String url) {
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new ValidationException("webhookUrl is not a valid URI: " + e.getReason());
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                || uri.getHost() == null) {
            throw new ValidationException("webhookUrl must be an absolute http(s) URL");
        }
    }

    public Optional<WebhookConfig> find(String tenantId) {
        return Optional.ofNullable(configs.get(tenantId));
    }
}
