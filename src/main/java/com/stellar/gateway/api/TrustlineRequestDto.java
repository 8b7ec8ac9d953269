package com.stellar.gateway.api;

import com.stellar.gateway.core.StellarTransactionService;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

/**
 * REST API request body for building a signed change-trust transaction.
 */
@Data
public class TrustlineRequestDto {

    @NotEmpty(message = StellarTransactionService.MISSING_PARAMETERS)
    private String secretKey;

    @NotEmpty(message = StellarTransactionService.MISSING_PARAMETERS)
    private String assetCode;

    @NotEmpty(message = StellarTransactionService.MISSING_PARAMETERS)
    private String assetIssuer;

    private String limit;
}
