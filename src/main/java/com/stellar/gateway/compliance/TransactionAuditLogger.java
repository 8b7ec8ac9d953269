package com.stellar.gateway.compliance;

import com.stellar.gateway.domain.PaymentOrder;
import com.stellar.gateway.domain.SignedEnvelope;
import com.stellar.gateway.domain.SubmissionReceipt;
import com.stellar.gateway.domain.TrustlineOrder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Logs transaction builds and submissions for audit. Secrets are masked and envelopes
 * abbreviated; hashes and account ids are logged in full or abbreviated form only.
 */
@Slf4j
@Component
public class TransactionAuditLogger {

    public void logPaymentRequest(PaymentOrder order) {
        log.info("[AUDIT] PAYMENT_REQUEST correlationId={} source={} destination={} amount={} asset={} issuer={}",
                order.getCorrelationId(),
                SecretMasker.maskSecret(order.getSourceSecret()),
                SecretMasker.abbreviateAccount(order.getDestinationAddress()),
                order.getAmount(),
                order.getAssetCode(),
                SecretMasker.abbreviateAccount(order.getAssetIssuer()));
    }

    public void logTrustlineRequest(TrustlineOrder order) {
        log.info("[AUDIT] TRUSTLINE_REQUEST correlationId={} account={} asset={} issuer={} limit={}",
                order.getCorrelationId(),
                SecretMasker.maskSecret(order.getSecretKey()),
                order.getAssetCode(),
                SecretMasker.abbreviateAccount(order.getAssetIssuer()),
                order.getLimit());
    }

    public void logSigned(String kind, String correlationId, String sourceAccount, SignedEnvelope envelope) {
        log.info("[AUDIT] {}_SIGNED correlationId={} source={} hash={} envelope={}",
                kind,
                correlationId,
                SecretMasker.abbreviateAccount(sourceAccount),
                envelope.getHash(),
                SecretMasker.abbreviateEnvelope(envelope.getXdr()));
    }

    public void logSubmission(String correlationId, SubmissionReceipt receipt) {
        log.info("[AUDIT] TRANSACTION_SUBMITTED correlationId={} transactionId={} ledger={} hash={}",
                correlationId,
                receipt.getTransactionId(),
                receipt.getLedger(),
                receipt.getHash());
    }

    public void logFailure(String kind, String correlationId, Throwable error) {
        log.warn("[AUDIT] {}_FAILED correlationId={} error={}", kind, correlationId, error.getMessage());
    }
}
