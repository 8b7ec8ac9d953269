package com.stellar.gateway.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.stellar.sdk.Network;
import org.stellar.sdk.Server;

/**
 * Wires the Stellar SDK: the network every transaction is signed for and the
 * Horizon client shared by all requests.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(StellarProperties.class)
@RequiredArgsConstructor
public class StellarConfig {

    private final StellarProperties properties;

    @Bean
    public Network stellarNetwork() {
        return resolveNetwork(properties.getNetwork());
    }

    @Bean(destroyMethod = "close")
    public Server horizonServer() {
        log.info("Horizon gateway: {}", properties.getHorizonUrl());
        return new Server(properties.getHorizonUrl());
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        log.info("Stellar service running on port {} (network={})", event.getWebServer().getPort(), properties.getNetwork());
    }

    static Network resolveNetwork(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("stellar.network must not be blank");
        }
        switch (value.trim().toUpperCase()) {
            case "PUBLIC":
                return Network.PUBLIC;
            case "TESTNET":
                return Network.TESTNET;
            default:
                return new Network(value);
        }
    }
}
