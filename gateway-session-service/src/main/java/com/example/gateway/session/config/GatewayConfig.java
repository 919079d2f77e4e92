package com.example.gateway.session.config;

import com.example.gateway.session.reconnect.FixedDelayReconnectPolicy;
import com.example.gateway.session.reconnect.ReconnectPolicy;
import com.example.gateway.shared.config.AppProperties;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class GatewayConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WebClient webhookWebClient(WebClient.Builder builder, AppProperties appProperties) {
        long timeoutMillis = appProperties.getWebhook().getTimeout();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.toIntExact(timeoutMillis))
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS)));
        return builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ReconnectPolicy reconnectPolicy(AppProperties appProperties) {
        AppProperties.Reconnect reconnect = appProperties.getReconnect();
        return new FixedDelayReconnectPolicy(Duration.ofMillis(reconnect.getDelay()), reconnect.getMaxAttempts());
    }
}
