package com.example.gateway.session.config;

import com.example.gateway.session.protocol.ProtocolClientFactory;
import com.example.gateway.session.protocol.loopback.LoopbackNetwork;
import com.example.gateway.session.protocol.loopback.LoopbackProtocolClientFactory;
import com.example.gateway.shared.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;

/**
 * Falls back to the in-process loopback network when no real protocol client is wired.
 */
@Configuration
@Slf4j
public class ProtocolConfig {

    @Bean
    @ConditionalOnMissingBean(ProtocolClientFactory.class)
    public LoopbackNetwork loopbackNetwork(Clock clock) {
        return new LoopbackNetwork(clock);
    }

    @Bean
    @ConditionalOnMissingBean(ProtocolClientFactory.class)
    public ProtocolClientFactory loopbackProtocolClientFactory(LoopbackNetwork loopbackNetwork,
                                                               @Qualifier("gatewayIoScheduler") Scheduler ioScheduler,
                                                               AppProperties appProperties) {
        log.warn("No protocol client configured; sessions will use the in-process loopback network");
        return new LoopbackProtocolClientFactory(loopbackNetwork, ioScheduler,
                Duration.ofMillis(appProperties.getProtocol().getLoopback().getOpenDelay()));
    }
}
