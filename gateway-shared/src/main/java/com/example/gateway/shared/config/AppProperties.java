package com.example.gateway.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
public class AppProperties {

    private String instanceName;

    @Valid
    private final Sse sse = new Sse();
    @Valid
    private final Reconnect reconnect = new Reconnect();
    @Valid
    private final Media media = new Media();
    @Valid
    private final Webhook webhook = new Webhook();
    @Valid
    private final Auth auth = new Auth();
    @Valid
    private final Credentials credentials = new Credentials();
    @Valid
    private final Protocol protocol = new Protocol();
    @Valid
    private final Directory directory = new Directory();

    @Data
    public static class Sse {
        @Positive
        private long heartbeatInterval = 15000L;
    }

    @Data
    public static class Reconnect {
        @Positive
        private long delay = 1500L;
        /** -1 retries forever. */
        @Min(-1)
        private int maxAttempts = -1;
    }

    @Data
    public static class Media {
        @Positive
        private int capacity = 200;
        @Positive
        private long ttl = 3600000L;
        @Positive
        private long maxItemBytes = 20L * 1024 * 1024;
        private boolean autoCapture = true;
        @Positive
        private long downloadTimeout = 30000L;
        @Positive
        private long sweepInterval = 60000L;
    }

    @Data
    public static class Webhook {
        @Positive
        private long timeout = 5000L;
    }

    @Data
    public static class Auth {
        private List<String> tokens = new ArrayList<>();
        private boolean disabled = false;
        @NotBlank
        private String apiKeyHeader = "x-api-key";
    }

    @Data
    public static class Credentials {
        @NotBlank
        private String dir = "./data/credentials";
    }

    @Data
    public static class Directory {
        /** Inbound message keys remembered per tenant for reactions. */
        @Positive
        private int recentMessages = 1000;
    }

    @Data
    public static class Protocol {
        private final Loopback loopback = new Loopback();

        @Data
        public static class Loopback {
            @Positive
            private long openDelay = 250L;
            private boolean devEndpointsEnabled = false;
        }
    }
}
