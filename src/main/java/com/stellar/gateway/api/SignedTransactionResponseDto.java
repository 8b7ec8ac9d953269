package com.stellar.gateway.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.stellar.gateway.domain.SignedEnvelope;
import lombok.Builder;
import lombok.Value;

/**
 * REST API response carrying a signed envelope for later submission.
 */
@Value
@Builder
public class SignedTransactionResponseDto {

    boolean success;

    @JsonProperty("signedXDR")
    String signedXdr;

    public static SignedTransactionResponseDto from(SignedEnvelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("SignedEnvelope cannot be null");
        }
        return SignedTransactionResponseDto.builder()
                .success(true)
                .signedXdr(envelope.getXdr())
                .build();
    }
}
