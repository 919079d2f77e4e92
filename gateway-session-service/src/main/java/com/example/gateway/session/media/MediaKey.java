package com.example.gateway.session.media;

import java.util.Objects;

public record MediaKey(String tenantId, String messageId) {

    public MediaKey {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(messageId, "messageId");
    }
}
