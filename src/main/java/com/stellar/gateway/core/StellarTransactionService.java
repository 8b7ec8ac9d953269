package com.stellar.gateway.core;

import com.stellar.gateway.api.InvalidRequestException;
import com.stellar.gateway.api.LedgerGatewayException;
import com.stellar.gateway.compliance.TransactionAuditLogger;
import com.stellar.gateway.config.StellarProperties;
import com.stellar.gateway.domain.AssetSpec;
import com.stellar.gateway.domain.GeneratedKeypair;
import com.stellar.gateway.domain.PaymentOrder;
import com.stellar.gateway.domain.SignedEnvelope;
import com.stellar.gateway.domain.SubmissionReceipt;
import com.stellar.gateway.domain.TrustlineOrder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.stellar.sdk.AbstractTransaction;
import org.stellar.sdk.Asset;
import org.stellar.sdk.AssetTypeNative;
import org.stellar.sdk.ChangeTrustAsset;
import org.stellar.sdk.KeyPair;
import org.stellar.sdk.Network;
import org.stellar.sdk.Transaction;
import org.stellar.sdk.TransactionBuilder;
import org.stellar.sdk.TransactionBuilderAccount;
import org.stellar.sdk.operations.ChangeTrustOperation;
import org.stellar.sdk.operations.Operation;
import org.stellar.sdk.operations.PaymentOperation;

import java.math.BigDecimal;

/**
 * Builds, signs and submits Stellar transactions. Input errors surface as
 * {@link InvalidRequestException}; everything the SDK or the gateway throws is wrapped
 * in {@link LedgerGatewayException} and reported as-is, without retry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StellarTransactionService {

    public static final String MISSING_PARAMETERS = "Missing required parameters";
    public static final String ISSUER_REQUIRED = "Asset issuer is required for non-native assets";
    public static final String MISSING_XDR = "Missing signed transaction XDR";

    private final LedgerGateway gateway;
    private final Network network;
    private final StellarProperties properties;
    private final TransactionAuditLogger auditLogger;

    public GeneratedKeypair createKeypair() {
        try {
            KeyPair keyPair = KeyPair.random();
            return new GeneratedKeypair(keyPair.getAccountId(), new String(keyPair.getSecretSeed()));
        } catch (Exception e) {
            throw wrap("Keypair generation failed", e);
        }
    }

    /**
     * Build a single-operation payment from the source account and sign it with the source secret.
     * The asset is resolved before the secret is decoded or the account loaded, so a non-native
     * asset without issuer is always reported as a 400 and never costs a gateway round trip.
     */
    public SignedEnvelope createPayment(PaymentOrder order) {
        requirePresent(MISSING_PARAMETERS, order.getSourceSecret(), order.getDestinationAddress(), order.getAmount());
        String assetCode = order.getAssetCode() != null ? order.getAssetCode() : AssetSpec.NATIVE_CODE;

        auditLogger.logPaymentRequest(order);
        try {
            Asset asset = resolveAsset(assetCode, order.getAssetIssuer());
            KeyPair source = KeyPair.fromSecretSeed(order.getSourceSecret());
            TransactionBuilderAccount account = gateway.loadAccount(source.getAccountId());

            PaymentOperation payment = PaymentOperation.builder()
                    .destination(order.getDestinationAddress())
                    .asset(asset)
                    .amount(new BigDecimal(order.getAmount()))
                    .build();

            SignedEnvelope envelope = buildAndSign(account, payment, source);
            auditLogger.logSigned("PAYMENT", order.getCorrelationId(), source.getAccountId(), envelope);
            return envelope;
        } catch (Exception e) {
            auditLogger.logFailure("PAYMENT", order.getCorrelationId(), e);
            throw wrap("Payment build failed", e);
        }
    }

    /**
     * Build a change-trust operation that lets the signer's account hold {@code assetCode}
     * from {@code assetIssuer}, up to the requested limit or the configured default.
     */
    public SignedEnvelope createTrustline(TrustlineOrder order) {
        requirePresent(MISSING_PARAMETERS, order.getSecretKey(), order.getAssetCode(), order.getAssetIssuer());
        String limit = isMissing(order.getLimit()) ? properties.getDefaultTrustLimit() : order.getLimit();

        auditLogger.logTrustlineRequest(order);
        try {
            KeyPair keyPair = KeyPair.fromSecretSeed(order.getSecretKey());
            Asset asset = Asset.createNonNativeAsset(order.getAssetCode(), order.getAssetIssuer());
            TransactionBuilderAccount account = gateway.loadAccount(keyPair.getAccountId());

            ChangeTrustOperation changeTrust = ChangeTrustOperation.builder()
                    .asset(new ChangeTrustAsset(asset))
                    .limit(new BigDecimal(limit))
                    .build();

            SignedEnvelope envelope = buildAndSign(account, changeTrust, keyPair);
            auditLogger.logSigned("TRUSTLINE", order.getCorrelationId(), keyPair.getAccountId(), envelope);
            return envelope;
        } catch (Exception e) {
            auditLogger.logFailure("TRUSTLINE", order.getCorrelationId(), e);
            throw wrap("Trustline build failed", e);
        }
    }

    /**
     * Decode a signed envelope against the configured network and forward it to the gateway.
     */
    public SubmissionReceipt submitTransaction(String signedXdr, String correlationId) {
        if (isMissing(signedXdr)) {
            throw new InvalidRequestException(MISSING_XDR);
        }
        try {
            AbstractTransaction transaction = AbstractTransaction.fromEnvelopeXdr(signedXdr, network);
            SubmissionReceipt receipt = gateway.submit(transaction);
            auditLogger.logSubmission(correlationId, receipt);
            return receipt;
        } catch (Exception e) {
            auditLogger.logFailure("SUBMISSION", correlationId, e);
            throw wrap("Transaction submission failed", e);
        }
    }

    private SignedEnvelope buildAndSign(TransactionBuilderAccount account, Operation operation, KeyPair signer) {
        Transaction transaction = new TransactionBuilder(account, network)
                .setBaseFee(properties.getBaseFee())
                .addOperation(operation)
                .setTimeout(properties.getTimeoutSeconds())
                .build();
        transaction.sign(signer);
        return new SignedEnvelope(transaction.toEnvelopeXdrBase64(), transaction.hashHex());
    }

    static Asset resolveAsset(String assetCode, String assetIssuer) {
        if (AssetSpec.isNative(assetCode)) {
            return new AssetTypeNative();
        }
        if (isMissing(assetIssuer)) {
            throw new InvalidRequestException(ISSUER_REQUIRED);
        }
        return Asset.createNonNativeAsset(assetCode, assetIssuer);
    }

    private static void requirePresent(String message, String... values) {
        for (String value : values) {
            if (isMissing(value)) {
                throw new InvalidRequestException(message);
            }
        }
    }

    private static boolean isMissing(String value) {
        return value == null || value.isEmpty();
    }

    private static RuntimeException wrap(String context, Exception e) {
        if (e instanceof LedgerGatewayException || e instanceof InvalidRequestException) {
            return (RuntimeException) e;
        }
        log.debug("{}: {}", context, e.toString());
        String message = e.getMessage() != null && !e.getMessage().isBlank()
                ? e.getMessage()
                : context + " (" + e.getClass().getSimpleName() + ")";
        return new LedgerGatewayException(message, e);
    }
}
