package com.stellar.gateway.core;

import com.stellar.gateway.domain.SubmissionReceipt;
import org.stellar.sdk.AbstractTransaction;
import org.stellar.sdk.TransactionBuilderAccount;

/**
 * The remote service that resolves account state and accepts transactions.
 * Signing and envelope encoding happen locally; only these two calls leave the process.
 */
public interface LedgerGateway {

    /**
     * Name of this gateway (like "HorizonLedgerGateway"). Used in logs and health details.
     */
    default String getGatewayName() {
        return this.getClass().getSimpleName();
    }

    /**
     * Current state of an account, including the sequence number the next transaction must use.
     *
     * @param accountId account id (G...)
     * @return account usable as a transaction source
     * @throws com.stellar.gateway.api.LedgerGatewayException if the account does not exist or the gateway fails
     */
    TransactionBuilderAccount loadAccount(String accountId);

    /**
     * Submit a signed transaction and wait for the gateway's verdict.
     *
     * @param transaction signed transaction or fee-bump transaction
     * @return acknowledgment of the accepted transaction (never null)
     * @throws com.stellar.gateway.api.LedgerGatewayException if the transaction is rejected or the gateway fails
     */
    SubmissionReceipt submit(AbstractTransaction transaction);

    /**
     * Is the gateway reachable? Used by the health indicator.
     */
    default boolean isHealthy() {
        return true;
    }
}
