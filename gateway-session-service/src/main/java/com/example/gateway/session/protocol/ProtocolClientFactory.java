package com.example.gateway.session.protocol;

@FunctionalInterface
public interface ProtocolClientFactory {

    ProtocolClient create(String tenantId);
}
