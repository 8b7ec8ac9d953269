package com.stellar.gateway.api;

import com.stellar.gateway.domain.SubmissionReceipt;
import lombok.Builder;
import lombok.Value;

/**
 * REST API response for an accepted transaction.
 */
@Value
@Builder
public class SubmitTransactionResponseDto {

    boolean success;
    String transactionId;
    Long ledger;
    String hash;

    public static SubmitTransactionResponseDto from(SubmissionReceipt receipt) {
        if (receipt == null) {
            throw new IllegalArgumentException("SubmissionReceipt cannot be null");
        }
        return SubmitTransactionResponseDto.builder()
                .success(true)
                .transactionId(receipt.getTransactionId())
                .ledger(receipt.getLedger())
                .hash(receipt.getHash())
                .build();
    }
}
