package com.stellar.gateway.adapters;

import com.stellar.gateway.config.StellarProperties;
import com.stellar.gateway.core.LedgerGateway;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the ledger gateway answers. Exposed as the {@code horizon} component of /actuator/health.
 */
@Component("horizon")
@RequiredArgsConstructor
public class HorizonHealthIndicator implements HealthIndicator {

    private final LedgerGateway gateway;
    private final StellarProperties properties;

    @Override
    public Health health() {
        Health.Builder builder = gateway.isHealthy() ? Health.up() : Health.down();
        return builder
                .withDetail("gateway", gateway.getGatewayName())
                .withDetail("url", properties.getHorizonUrl())
                .withDetail("network", properties.getNetwork())
                .build();
    }
}
