package com.example.gateway.session.media;

import com.example.gateway.session.event.EventBus;
import com.example.gateway.session.event.EventPayload;
import com.example.gateway.session.event.GatewayEvent;
import com.example.gateway.session.model.SessionSnapshot;
import com.example.gateway.session.protocol.InboundMessage;
import com.example.gateway.session.protocol.ProtocolClient;
import com.example.gateway.shared.config.AppProperties;
import com.example.gateway.shared.config.MonitoringConfig;
import com.example.gateway.shared.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Downloads inbound attachments into the {@link MediaCache} and announces the outcome with a
 * {@code media} event. Capture never fails the message itself.
 */
@Service
@Slf4j
public class MediaCaptureService {

    private static final Map<String, String> EXTENSIONS = Map.ofEntries(
            Map.entry("image/jpeg", "jpg"),
            Map.entry("image/png", "png"),
            Map.entry("image/webp", "webp"),
            Map.entry("image/gif", "gif"),
            Map.entry("video/mp4", "mp4"),
            Map.entry("video/3gpp", "3gp"),
            Map.entry("audio/ogg", "ogg"),
            Map.entry("audio/mpeg", "mp3"),
            Map.entry("audio/mp4", "m4a"),
            Map.entry("audio/aac", "aac"),
            Map.entry("application/pdf", "pdf"),
            Map.entry("application/zip", "zip"),
            Map.entry("text/plain", "txt"),
            Map.entry("application/msword", "doc"),
            Map.entry("application/vnd.openxmlformats-officedocument.wordprocessingml.document", "docx"),
            Map.entry("application/vnd.ms-excel", "xls"),
            Map.entry("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", "xlsx"));

    private final MediaCache mediaCache;
    private final EventBus eventBus;
    private final MonitoringConfig.GatewayMetricsCollector metricsCollector;
    private final Scheduler ioScheduler;
    private final Clock clock;
    private final boolean autoCapture;
    private final long maxItemBytes;
    private final Duration downloadTimeout;

    public MediaCaptureService(MediaCache mediaCache,
                               EventBus eventBus,
                               MonitoringConfig.GatewayMetricsCollector metricsCollector,
                               @Qualifier("gatewayIoScheduler") Scheduler ioScheduler,
                               Clock clock,
                               AppProperties appProperties) {
        this.mediaCache = mediaCache;
        this.eventBus = eventBus;
        this.metricsCollector = metricsCollector;
        this.ioScheduler = ioScheduler;
        this.clock = clock;
        AppProperties.Media media = appProperties.getMedia();
        this.autoCapture = media.isAutoCapture();
        this.maxItemBytes = media.getMaxItemBytes();
        this.downloadTimeout = Duration.ofMillis(media.getDownloadTimeout());
    }

    /**
     * Starts capturing the attachment of {@code message} and returns immediately.
     *
     * @param session supplies the session state to stamp on the resulting event
     */
    public void capture(String tenantId, ProtocolClient client, InboundMessage message, Supplier<SessionSnapshot> session) {
        if (!autoCapture || !message.hasAttachment()) {
            return;
        }
        InboundMessage.Attachment attachment = message.attachment();
        String mime = normalizeMime(attachment.mimeType());
        String filename = filenameFor(message.messageId(), attachment);

        if (attachment.declaredSize() > maxItemBytes) {
            log.warn("Attachment {} of tenant {} announced {} bytes, above the {} byte limit; not captured",
                    message.messageId(), tenantId, attachment.declaredSize(), maxItemBytes);
            publishFailure(message, mime, filename, ErrorCode.MEDIA_TOO_LARGE, session);
            return;
        }

        Mono.defer(() -> Mono.fromFuture(client.downloadMedia(message)))
                .subscribeOn(ioScheduler)
                .timeout(downloadTimeout)
                .subscribe(
                        bytes -> store(tenantId, message, mime, filename, bytes, session),
                        error -> {
                            String reason = error instanceof TimeoutException
                                    ? "timed out after " + downloadTimeout.toMillis() + "ms"
                                    : error.getMessage();
                            log.warn("Failed to download attachment {} of tenant {}: {}",
                                    message.messageId(), tenantId, reason);
                            publishFailure(message, mime, filename, ErrorCode.MEDIA_DOWNLOAD_FAILED, session);
                        });
    }

    private void store(String tenantId, InboundMessage message, String mime, String filename,
                       byte[] bytes, Supplier<SessionSnapshot> session) {
        if (bytes.length > maxItemBytes) {
            log.warn("Attachment {} of tenant {} is {} bytes, above the {} byte limit; not captured",
                    message.messageId(), tenantId, bytes.length, maxItemBytes);
            publishFailure(message, mime, filename, ErrorCode.MEDIA_TOO_LARGE, session);
            return;
        }
        String hash = sha256(bytes);
        mediaCache.put(new MediaKey(tenantId, message.messageId()),
                new MediaItem(bytes, mime, filename, bytes.length, hash, clock.instant()));
        metricsCollector.incrementCounter("gateway.media.captured", "status", "success");
        log.info("Captured attachment {} for tenant {} ({} bytes, {})", message.messageId(), tenantId, bytes.length, mime);

        EventPayload.Media payload = new EventPayload.Media(message.messageId(), true, mime, filename,
                (long) bytes.length, hash, mediaUrl(tenantId, message.messageId()), null);
        eventBus.publish(GatewayEvent.media(session.get(), payload, clock.instant()));
    }

    private void publishFailure(InboundMessage message, String mime, String filename,
                                ErrorCode code, Supplier<SessionSnapshot> session) {
        metricsCollector.incrementCounter("gateway.media.captured", "status", "failed");
        EventPayload.Media payload = new EventPayload.Media(message.messageId(), false, mime, filename,
                null, null, null, code.code());
        eventBus.publish(GatewayEvent.media(session.get(), payload, clock.instant()));
    }

    static String mediaUrl(String tenantId, String messageId) {
        return "/media/" + tenantId + "/" + messageId;
    }

    static String normalizeMime(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return "application/octet-stream";
        }
        int parameters = mimeType.indexOf(';');
        String base = parameters >= 0 ? mimeType.substring(0, parameters) : mimeType;
        return base.trim().toLowerCase(Locale.ROOT);
    }

    static String filenameFor(String messageId, InboundMessage.Attachment attachment) {
        if (attachment.fileName() != null && !attachment.fileName().isBlank()) {
            return attachment.fileName();
        }
        return messageId + "." + EXTENSIONS.getOrDefault(normalizeMime(attachment.mimeType()), "bin");
    }

    static String sha256(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
