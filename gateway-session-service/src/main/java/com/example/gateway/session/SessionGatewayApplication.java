package com.example.gateway.session;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Multi-tenant session gateway.
 *
 * Keeps one connection to the messaging network per tenant and distributes its events:
 * - Server-Sent Events to any number of subscribers per tenant
 * - best-effort webhooks per tenant
 * - short-lived capture of inbound attachments
 */
@SpringBootApplication(scanBasePackages = "com.example.gateway")
@EnableScheduling
public class SessionGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(SessionGatewayApplication.class, args);
    }
}
