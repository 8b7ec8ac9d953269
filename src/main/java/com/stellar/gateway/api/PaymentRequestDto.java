package com.stellar.gateway.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.stellar.gateway.core.StellarTransactionService;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

/**
 * REST API request body for building a signed payment.
 */
@Data
public class PaymentRequestDto {

    @NotEmpty(message = StellarTransactionService.MISSING_PARAMETERS)
    private String sourceSecret;

    @NotEmpty(message = StellarTransactionService.MISSING_PARAMETERS)
    private String destinationAddress;

    /** Decimal amount as a string (e.g. "10" or "0.5000000"). */
    @NotEmpty(message = StellarTransactionService.MISSING_PARAMETERS)
    private String amount;

    /** Defaults to XLM, the native asset, when the field is absent. */
    private String assetCode;

    @JsonIgnore
    private boolean assetCodePresent;

    /** Required unless assetCode is XLM. */
    private String assetIssuer;

    public void setAssetCode(String assetCode) {
        this.assetCode = assetCode;
        this.assetCodePresent = true;
    }

    /**
     * Asset code to build with: an explicit {@code "assetCode": null} names no asset at all and
     * is passed on as an empty (non-native) code; only an absent field falls back to XLM.
     */
    public String effectiveAssetCode() {
        if (assetCode == null && assetCodePresent) {
            return "";
        }
        return assetCode;
    }
}
