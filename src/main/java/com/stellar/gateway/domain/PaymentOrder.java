package com.stellar.gateway.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Canonical payment request handed from the API layer to the transaction service.
 * Amount is kept as the caller's decimal string; the SDK parses it.
 */
@Value
@Builder
public class PaymentOrder {

    String sourceSecret;
    String destinationAddress;
    String amount;

    /** Asset code; {@code XLM} (or null) selects the native asset. */
    String assetCode;

    /** Issuer account id; required for every non-native asset, ignored for XLM. */
    String assetIssuer;

    /** Correlation ID for tracing the request through logs. */
    String correlationId;
}
