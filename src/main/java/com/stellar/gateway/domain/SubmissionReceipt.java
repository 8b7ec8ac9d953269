package com.stellar.gateway.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Horizon's acknowledgment of an accepted transaction.
 */
@Value
@Builder
public class SubmissionReceipt {

    String transactionId;
    Long ledger;
    String hash;
}
