package com.stellar.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Stellar Transaction Service. Exposes:
 * <ul>
 *   <li>Keypair generation</li>
 *   <li>Payment and trustline transactions, built and signed locally with the Stellar SDK</li>
 *   <li>Submission of signed envelopes to Horizon</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
public class StellarGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(StellarGatewayApplication.class, args);
    }
}
