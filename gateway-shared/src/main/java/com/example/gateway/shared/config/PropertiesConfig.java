package com.example.gateway.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PropertiesConfig {

    @Value("${gateway.instance-name:${HOSTNAME:session-gateway-0}}")
    private String instanceName;

    @Bean
    @ConfigurationProperties(prefix = "gateway")
    public AppProperties appProperties() {
        AppProperties properties = new AppProperties();

        // Everything else under gateway.* is bound by @ConfigurationProperties.
        properties.setInstanceName(instanceName);
        return properties;
    }
}
