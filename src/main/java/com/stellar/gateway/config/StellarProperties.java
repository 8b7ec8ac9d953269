package com.stellar.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Settings for the Horizon gateway and the transactions this service builds.
 * Defaults target the public network through SDF's public Horizon.
 */
@Data
@ConfigurationProperties(prefix = "stellar")
public class StellarProperties {

    private String horizonUrl = "https://horizon.stellar.org";

    /** {@code PUBLIC}, {@code TESTNET}, or a literal network passphrase. */
    private String network = "PUBLIC";

    /** Base fee per operation, in stroops. */
    private long baseFee = 100;

    private long timeoutSeconds = 30;

    private String defaultTrustLimit = "1000000000";

    private Cors cors = new Cors();

    @Data
    public static class Cors {
        private List<String> allowedOrigins = List.of("*");
    }
}
