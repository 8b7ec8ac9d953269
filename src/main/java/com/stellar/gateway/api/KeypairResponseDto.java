package com.stellar.gateway.api;

import com.stellar.gateway.domain.GeneratedKeypair;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class KeypairResponseDto {

    boolean success;
    String publicKey;
    String secretKey;

    public static KeypairResponseDto from(GeneratedKeypair keypair) {
        return KeypairResponseDto.builder()
                .success(true)
                .publicKey(keypair.getPublicKey())
                .secretKey(keypair.getSecretKey())
                .build();
    }
}
