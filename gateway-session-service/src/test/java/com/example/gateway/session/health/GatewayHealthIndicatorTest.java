package com.example.gateway.session.health;

import com.example.gateway.session.model.Identity;
import com.example.gateway.session.support.GatewayHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayHealthIndicatorTest {

    private final GatewayHarness harness = new GatewayHarness();
    private final GatewayHealthIndicator indicator = new GatewayHealthIndicator(
            harness.registry, harness.subscribers, harness.mediaCache, harness.properties);

    @AfterEach
    void tearDown() {
        harness.dispose();
    }

    @Test
    void reportsTheInstanceAndSessionsByStatus() {
        harness.properties.setInstanceName("gateway-7");
        harness.registry.start("t1", null);
        harness.registry.start("t2", null);
        harness.clients.last().open(new Identity("15550001111@s.whatsapp.net", "+15550001111"));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("instance", "gateway-7")
                .containsEntry("sessions", 2)
                .containsEntry("subscribers", 0);
        assertThat(health.getDetails().get("sessionsByStatus"))
                .isEqualTo(Map.of("connected", 1L, "connecting", 1L));
    }

    @Test
    void unnamedInstanceIsLeftOut() {
        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).doesNotContainKey("instance").containsEntry("sessions", 0);
    }
}
