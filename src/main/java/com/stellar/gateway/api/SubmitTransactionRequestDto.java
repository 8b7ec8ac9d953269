package com.stellar.gateway.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.stellar.gateway.core.StellarTransactionService;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

@Data
public class SubmitTransactionRequestDto {

    @JsonProperty("signedXDR")
    @NotEmpty(message = StellarTransactionService.MISSING_XDR)
    private String signedXdr;
}
