package com.stellar.gateway.domain;

import lombok.Value;

/**
 * A signed transaction envelope, base64 XDR, ready for submission.
 */
@Value
public class SignedEnvelope {

    String xdr;

    /** Hex transaction hash for the configured network. */
    String hash;
}
