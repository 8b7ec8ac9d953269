package com.stellar.gateway.domain;

import lombok.Value;

/**
 * A freshly generated Stellar keypair. Returned to the caller once and never stored.
 */
@Value
public class GeneratedKeypair {

    /** Account id (G...). */
    String publicKey;

    /** Secret seed (S...). */
    String secretKey;
}
