package com.stellar.gateway.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stellar.gateway.api.LedgerGatewayException;
import com.stellar.gateway.core.LedgerGateway;
import com.stellar.gateway.domain.SubmissionReceipt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.stellar.sdk.AbstractTransaction;
import org.stellar.sdk.FeeBumpTransaction;
import org.stellar.sdk.Server;
import org.stellar.sdk.Transaction;
import org.stellar.sdk.TransactionBuilderAccount;
import org.stellar.sdk.exception.NetworkException;
import org.stellar.sdk.responses.TransactionResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link LedgerGateway} backed by a Horizon server. Horizon error responses are turned into
 * messages that carry the HTTP status and, for rejected transactions, the result codes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HorizonLedgerGateway implements LedgerGateway {

    private static final int MAX_BODY_IN_MESSAGE = 300;

    private final Server server;
    private final ObjectMapper objectMapper;

    @Override
    public TransactionBuilderAccount loadAccount(String accountId) {
        log.debug("Loading account {}", accountId);
        try {
            return server.accounts().account(accountId);
        } catch (NetworkException e) {
            throw new LedgerGatewayException(describe("Account lookup failed", e), e);
        }
    }

    @Override
    public SubmissionReceipt submit(AbstractTransaction transaction) {
        log.debug("Submitting transaction hash={}", transaction.hashHex());
        TransactionResponse response;
        try {
            if (transaction instanceof FeeBumpTransaction) {
                response = server.submitTransaction((FeeBumpTransaction) transaction);
            } else if (transaction instanceof Transaction) {
                response = server.submitTransaction((Transaction) transaction);
            } else {
                throw new LedgerGatewayException("Unsupported transaction type: " + transaction.getClass().getSimpleName());
            }
        } catch (NetworkException e) {
            throw new LedgerGatewayException(describe("Transaction submission failed", e), e);
        }
        return SubmissionReceipt.builder()
                .transactionId(response.getId())
                .ledger(response.getLedger())
                .hash(response.getHash())
                .build();
    }

    @Override
    public boolean isHealthy() {
        try {
            server.root();
            return true;
        } catch (RuntimeException e) {
            log.warn("Horizon health check failed: {}", e.toString());
            return false;
        }
    }

    /**
     * Message for a Horizon error: the SDK's (or its cause's) message, HTTP status, and the transaction and
     * operation result codes when the body is a Horizon problem document.
     */
    String describe(String context, NetworkException e) {
        StringBuilder message = new StringBuilder();
        message.append(messageOrCause(e, context));
        if (e.getCode() != null) {
            message.append(" (HTTP ").append(e.getCode()).append(')');
        }
        List<String> resultCodes = resultCodes(e.getBody());
        if (!resultCodes.isEmpty()) {
            message.append(": ").append(String.join(", ", resultCodes));
        } else if (e.getBody() != null && !e.getBody().isBlank() && !looksLikeJson(e.getBody())) {
            String body = e.getBody().strip();
            message.append(": ").append(body.length() > MAX_BODY_IN_MESSAGE ? body.substring(0, MAX_BODY_IN_MESSAGE) : body);
        }
        return message.toString();
    }

    /**
     * First non-blank message along the cause chain; connection failures often carry their
     * text only on the underlying I/O exception.
     */
    private static String messageOrCause(Throwable e, String fallback) {
        Throwable t = e;
        while (t != null) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                return t.getMessage();
            }
            t = t.getCause();
        }
        return fallback;
    }

    List<String> resultCodes(String body) {
        List<String> codes = new ArrayList<>();
        if (body == null || body.isBlank() || !looksLikeJson(body)) {
            return codes;
        }
        try {
            JsonNode resultCodes = objectMapper.readTree(body).path("extras").path("result_codes");
            JsonNode transactionCode = resultCodes.path("transaction");
            if (transactionCode.isTextual()) {
                codes.add(transactionCode.asText());
            }
            for (JsonNode operationCode : resultCodes.path("operations")) {
                codes.add(operationCode.asText());
            }
        } catch (Exception ex) {
            log.debug("Horizon error body is not a problem document: {}", ex.toString());
        }
        return codes;
    }

    private static boolean looksLikeJson(String body) {
        return body.strip().startsWith("{");
    }
}
