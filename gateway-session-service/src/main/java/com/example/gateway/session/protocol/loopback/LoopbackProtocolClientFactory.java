package com.example.gateway.session.protocol.loopback;

import com.example.gateway.session.protocol.ProtocolClient;
import com.example.gateway.session.protocol.ProtocolClientFactory;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

public class LoopbackProtocolClientFactory implements ProtocolClientFactory {

    private final LoopbackNetwork network;
    private final Scheduler scheduler;
    private final Duration openDelay;

    public LoopbackProtocolClientFactory(LoopbackNetwork network, Scheduler scheduler, Duration openDelay) {
        this.network = network;
        this.scheduler = scheduler;
        this.openDelay = openDelay;
    }

    @Override
    public ProtocolClient create(String tenantId) {
        return new LoopbackProtocolClient(tenantId, network, scheduler, openDelay);
    }
}
