package com.example.gateway.session.event;

import com.example.gateway.shared.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum EventKind {
    STATUS("status"),
    QR("qr"),
    CONNECTED("connected"),
    MESSAGE_INCOMING("message_incoming"),
    MEDIA("media"),
    ERROR("error");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static EventKind fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(kind -> kind.wireName.equalsIgnoreCase(wireName))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown event kind: " + wireName));
    }
}
