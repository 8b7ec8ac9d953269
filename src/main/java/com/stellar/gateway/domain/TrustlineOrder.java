package com.stellar.gateway.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Request to authorize an account to hold a non-native asset up to {@code limit}.
 */
@Value
@Builder
public class TrustlineOrder {

    String secretKey;
    String assetCode;
    String assetIssuer;

    /** Trust limit as a decimal string; null means the configured default. */
    String limit;

    String correlationId;
}
