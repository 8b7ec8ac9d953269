package com.stellar.gateway.api;

import com.stellar.gateway.core.StellarTransactionService;
import com.stellar.gateway.domain.GeneratedKeypair;
import com.stellar.gateway.domain.PaymentOrder;
import com.stellar.gateway.domain.SignedEnvelope;
import com.stellar.gateway.domain.SubmissionReceipt;
import com.stellar.gateway.domain.TrustlineOrder;
import com.stellar.gateway.compliance.SecretMasker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST API for keypairs and for building, signing and submitting Stellar transactions.
 * Request bodies are optional at the binding level so an absent body reports the same
 * "missing parameters" error as absent fields.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Stellar", description = "Build, sign and submit Stellar transactions")
public class StellarController {

    private final StellarTransactionService transactionService;

    @GetMapping("/create-keypair")
    @Operation(summary = "Generate keypair",
            description = "Generates a random keypair. Nothing is stored; the secret key is returned once.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Keypair generated",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = KeypairResponseDto.class))),
            @ApiResponse(responseCode = "500", description = "Body: { \"success\": false, \"error\": \"...\" }")
    })
    public ResponseEntity<KeypairResponseDto> createKeypair() {
        GeneratedKeypair keypair = transactionService.createKeypair();
        log.debug("Generated keypair publicKey={}", keypair.getPublicKey());
        return ResponseEntity.ok(KeypairResponseDto.from(keypair));
    }

    @PostMapping("/create-payment")
    @Operation(summary = "Build signed payment",
            description = "Loads the source account from Horizon, builds a one-operation payment (fee 100 stroops, "
                    + "30s timeout) and signs it with sourceSecret. assetCode defaults to XLM; any other code needs assetIssuer. "
                    + "Returns the signed envelope as base64 XDR; nothing is submitted.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment signed",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = SignedTransactionResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Missing parameters, or non-native asset without issuer. Body: { \"success\": false, \"error\": \"...\" }"),
            @ApiResponse(responseCode = "500", description = "SDK or Horizon failure (bad secret, unknown account, ...). Body: { \"success\": false, \"error\": \"...\" }")
    })
    public ResponseEntity<SignedTransactionResponseDto> createPayment(@Valid @RequestBody(required = false) PaymentRequestDto dto) {
        if (dto == null) {
            throw new InvalidRequestException(StellarTransactionService.MISSING_PARAMETERS);
        }
        PaymentOrder order = PaymentOrder.builder()
                .sourceSecret(dto.getSourceSecret())
                .destinationAddress(dto.getDestinationAddress())
                .amount(dto.getAmount())
                .assetCode(dto.effectiveAssetCode())
                .assetIssuer(dto.getAssetIssuer())
                .correlationId(UUID.randomUUID().toString())
                .build();

        SignedEnvelope envelope = transactionService.createPayment(order);
        log.debug("Payment signed: correlationId={} hash={}", order.getCorrelationId(), envelope.getHash());
        return ResponseEntity.ok(SignedTransactionResponseDto.from(envelope));
    }

    @PostMapping("/create-trustline")
    @Operation(summary = "Build signed trustline",
            description = "Builds a change-trust operation for assetCode/assetIssuer with the given limit "
                    + "(default 1000000000) and signs it with secretKey. Returns the signed envelope as base64 XDR.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Trustline signed",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = SignedTransactionResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Missing parameters. Body: { \"success\": false, \"error\": \"...\" }"),
            @ApiResponse(responseCode = "500", description = "SDK or Horizon failure. Body: { \"success\": false, \"error\": \"...\" }")
    })
    public ResponseEntity<SignedTransactionResponseDto> createTrustline(@Valid @RequestBody(required = false) TrustlineRequestDto dto) {
        if (dto == null) {
            throw new InvalidRequestException(StellarTransactionService.MISSING_PARAMETERS);
        }
        TrustlineOrder order = TrustlineOrder.builder()
                .secretKey(dto.getSecretKey())
                .assetCode(dto.getAssetCode())
                .assetIssuer(dto.getAssetIssuer())
                .limit(dto.getLimit())
                .correlationId(UUID.randomUUID().toString())
                .build();

        SignedEnvelope envelope = transactionService.createTrustline(order);
        log.debug("Trustline signed: correlationId={} hash={}", order.getCorrelationId(), envelope.getHash());
        return ResponseEntity.ok(SignedTransactionResponseDto.from(envelope));
    }

    @PostMapping("/submit-transaction")
    @Operation(summary = "Submit signed transaction",
            description = "Decodes signedXDR against the configured network and submits it to Horizon. "
                    + "Returns Horizon's transaction id, ledger and hash.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Transaction accepted",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = SubmitTransactionResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Missing signedXDR. Body: { \"success\": false, \"error\": \"...\" }"),
            @ApiResponse(responseCode = "500", description = "Invalid envelope or rejected by Horizon. Body: { \"success\": false, \"error\": \"...\" }")
    })
    public ResponseEntity<SubmitTransactionResponseDto> submitTransaction(@Valid @RequestBody(required = false) SubmitTransactionRequestDto dto) {
        if (dto == null) {
            throw new InvalidRequestException(StellarTransactionService.MISSING_XDR);
        }
        String signedXdr = dto.getSignedXdr();
        String correlationId = UUID.randomUUID().toString();
        log.debug("Submitting envelope correlationId={} envelope={}", correlationId, SecretMasker.abbreviateEnvelope(signedXdr));

        SubmissionReceipt receipt = transactionService.submitTransaction(signedXdr, correlationId);
        return ResponseEntity.ok(SubmitTransactionResponseDto.from(receipt));
    }
}
