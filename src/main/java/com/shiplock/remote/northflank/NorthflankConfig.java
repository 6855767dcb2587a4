package com.shiplock.remote.northflank;

import com.shiplock.remote.RemoteControlClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the Northflank {@link RemoteControlClient}.
 * The transport is picked by {@code shiplock.northflank.transport} ({@code api} by default).
 */
@Configuration
@EnableConfigurationProperties(NorthflankProperties.class)
public class NorthflankConfig {

    private static final Logger log = LoggerFactory.getLogger(NorthflankConfig.class);

    @Bean
    @ConditionalOnProperty(name = "shiplock.northflank.transport", havingValue = "api", matchIfMissing = true)
    public RemoteControlClient northflankApiClient(NorthflankProperties properties) {
        log.info("Northflank transport: REST API at {}", properties.getApiUrl());
        return new NorthflankApiClient(properties);
    }

    @Bean
    @ConditionalOnProperty(name = "shiplock.northflank.transport", havingValue = "cli")
    public RemoteControlClient northflankCliClient(NorthflankProperties properties) {
        log.info("Northflank transport: '{}' CLI", properties.getCliCommand());
        return new NorthflankCliClient(properties);
    }
}
