package com.example.gateway.session.sse;

import com.example.gateway.session.event.GatewayEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class SseEventFactory {

    static final String HEARTBEAT = "heartbeat";
    static final String CLOSED = "closed";
    static final String SERVER_SHUTDOWN = "server_shutdown";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * The SSE event name is the event kind; the data is the whole event as JSON.
     *
     * @return the event, or null if serialization fails
     */
    public ServerSentEvent<String> fromGatewayEvent(GatewayEvent event) {
        return createEvent(event.kind().wireName(), event);
    }

    public ServerSentEvent<String> createHeartbeatEvent() {
        return createEvent(HEARTBEAT, Map.of("timestamp", clock.instant().toString()));
    }

    /**
     * Last event a subscriber sees when its tenant's session is stopped.
     */
    public ServerSentEvent<String> createClosedEvent(String tenantId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tenantId", tenantId);
        data.put("message", "Session stopped");
        data.put("timestamp", clock.instant().toString());
        return createEvent(CLOSED, data);
    }

    public ServerSentEvent<String> createShutdownEvent() {
        return ServerSentEvent.<String>builder()
                .event(SERVER_SHUTDOWN)
                .data("Server is shutting down. Please reconnect momentarily.")
                .build();
    }

    private ServerSentEvent<String> createEvent(String name, Object data) {
        try {
            return ServerSentEvent.<String>builder()
                    .event(name)
                    .data(objectMapper.writeValueAsString(data))
                    .build();
        } catch (JsonProcessingException e) {
            log.error("Error serializing payload for SSE event {}: {}", name, e.getMessage());
            return null;
        }
    }
}
