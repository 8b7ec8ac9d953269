package com.stellar.gateway.api;

/**
 * Thrown when the SDK or Horizon fails: bad secret seed, unknown account, malformed
 * envelope, rejected submission, network error. Handler returns HTTP 500 with the
 * underlying message. Never retried.
 */
public class LedgerGatewayException extends RuntimeException {

    public LedgerGatewayException(String message) {
        super(message);
    }

    public LedgerGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
