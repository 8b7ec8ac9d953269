package com.stellar.gateway.api;

import com.stellar.gateway.core.StellarTransactionService;
import com.stellar.gateway.domain.GeneratedKeypair;
import com.stellar.gateway.domain.PaymentOrder;
import com.stellar.gateway.domain.SignedEnvelope;
import com.stellar.gateway.domain.SubmissionReceipt;
import com.stellar.gateway.domain.TrustlineOrder;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for StellarController and StatusController using MockMvc.
 */
@WebMvcTest(controllers = {StellarController.class, StatusController.class})
class StellarControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private StellarTransactionService transactionService;

    @Test
    void homeReturnsSuccess() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    void apiReturnsGreeting() throws Exception {
        mockMvc.perform(get("/api"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value(StatusController.GREETING));
    }

    @Test
    void createKeypairReturnsKeys() throws Exception {
        when(transactionService.createKeypair()).thenReturn(new GeneratedKeypair("GPUBLIC", "SSECRET"));

        mockMvc.perform(get("/api/create-keypair"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.publicKey").value("GPUBLIC"))
                .andExpect(jsonPath("$.secretKey").value("SSECRET"));
    }

    @Test
    void createPaymentReturnsSignedXdr() throws Exception {
        when(transactionService.createPayment(any())).thenReturn(new SignedEnvelope("AAAAAgAAAAB=", "abc123"));

        mockMvc.perform(post("/api/create-payment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "sourceSecret": "SSOURCE",
                                  "destinationAddress": "GDEST",
                                  "amount": "10",
                                  "assetCode": "USDC",
                                  "assetIssuer": "GISSUER"
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.signedXDR").value("AAAAAgAAAAB="));

        ArgumentCaptor<PaymentOrder> order = ArgumentCaptor.forClass(PaymentOrder.class);
        verify(transactionService).createPayment(order.capture());
        assertThat(order.getValue().getSourceSecret()).isEqualTo("SSOURCE");
        assertThat(order.getValue().getDestinationAddress()).isEqualTo("GDEST");
        assertThat(order.getValue().getAmount()).isEqualTo("10");
        assertThat(order.getValue().getAssetCode()).isEqualTo("USDC");
        assertThat(order.getValue().getAssetIssuer()).isEqualTo("GISSUER");
        assertThat(order.getValue().getCorrelationId()).isNotBlank();
    }

    @Test
    void createPaymentWithMissingDestinationReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/create-payment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "sourceSecret": "SSOURCE", "amount": "10" }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value(StellarTransactionService.MISSING_PARAMETERS));

        verifyNoInteractions(transactionService);
    }

    @Test
    void createPaymentWithoutBodyReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/create-payment").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(StellarTransactionService.MISSING_PARAMETERS));

        verifyNoInteractions(transactionService);
    }

    @Test
    void createPaymentWithMalformedJsonReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/create-payment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"sourceSecret\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void createPaymentWithNonJsonContentTypeReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/create-payment")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("hello"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value(StellarTransactionService.MISSING_PARAMETERS));

        mockMvc.perform(post("/api/submit-transaction")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("AAAAsigned"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(StellarTransactionService.MISSING_XDR));

        verifyNoInteractions(transactionService);
    }

    @Test
    void explicitNullAssetCodeIsNotTreatedAsNative() throws Exception {
        when(transactionService.createPayment(any())).thenReturn(new SignedEnvelope("AAAAAgAAAAB=", "abc123"));

        mockMvc.perform(post("/api/create-payment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "sourceSecret": "SSOURCE", "destinationAddress": "GDEST", "amount": "10", "assetCode": null }
                                """))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/create-payment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "sourceSecret": "SSOURCE", "destinationAddress": "GDEST", "amount": "10" }
                                """))
                .andExpect(status().isOk());

        ArgumentCaptor<PaymentOrder> order = ArgumentCaptor.forClass(PaymentOrder.class);
        verify(transactionService, times(2)).createPayment(order.capture());
        assertThat(order.getAllValues().get(0).getAssetCode()).isEmpty();
        assertThat(order.getAllValues().get(1).getAssetCode()).isNull();
    }

    @Test
    void createPaymentWithoutIssuerReturnsIssuerRequired() throws Exception {
        when(transactionService.createPayment(any()))
                .thenThrow(new InvalidRequestException(StellarTransactionService.ISSUER_REQUIRED));

        mockMvc.perform(post("/api/create-payment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "sourceSecret": "SSOURCE", "destinationAddress": "GDEST", "amount": "10", "assetCode": "USDC" }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value(StellarTransactionService.ISSUER_REQUIRED));
    }

    @Test
    void createPaymentDownstreamFailureReturnsServerError() throws Exception {
        when(transactionService.createPayment(any()))
                .thenThrow(new LedgerGatewayException("Account lookup failed (HTTP 404)"));

        mockMvc.perform(post("/api/create-payment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "sourceSecret": "SSOURCE", "destinationAddress": "GDEST", "amount": "10" }
                                """))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Account lookup failed (HTTP 404)"));
    }

    @Test
    void createTrustlineReturnsSignedXdr() throws Exception {
        when(transactionService.createTrustline(any())).thenReturn(new SignedEnvelope("AAAAtrust", "def456"));

        mockMvc.perform(post("/api/create-trustline")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "secretKey": "SSECRET", "assetCode": "USDC", "assetIssuer": "GISSUER", "limit": "5000" }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.signedXDR").value("AAAAtrust"));

        ArgumentCaptor<TrustlineOrder> order = ArgumentCaptor.forClass(TrustlineOrder.class);
        verify(transactionService).createTrustline(order.capture());
        assertThat(order.getValue().getLimit()).isEqualTo("5000");
    }

    @Test
    void createTrustlineWithMissingIssuerReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/create-trustline")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "secretKey": "SSECRET", "assetCode": "USDC" }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(StellarTransactionService.MISSING_PARAMETERS));

        verifyNoInteractions(transactionService);
    }

    @Test
    void submitTransactionReturnsReceipt() throws Exception {
        when(transactionService.submitTransaction(eq("AAAAsigned"), anyString()))
                .thenReturn(SubmissionReceipt.builder().transactionId("tx-1").ledger(4242L).hash("hash-1").build());

        mockMvc.perform(post("/api/submit-transaction")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "signedXDR": "AAAAsigned" }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.transactionId").value("tx-1"))
                .andExpect(jsonPath("$.ledger").value(4242))
                .andExpect(jsonPath("$.hash").value("hash-1"));
    }

    @Test
    void submitTransactionWithoutXdrReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/submit-transaction")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value(StellarTransactionService.MISSING_XDR));

        mockMvc.perform(post("/api/submit-transaction").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(StellarTransactionService.MISSING_XDR));

        verifyNoInteractions(transactionService);
    }

    @Test
    void submitTransactionRejectedByGatewayReturnsServerError() throws Exception {
        when(transactionService.submitTransaction(anyString(), anyString()))
                .thenThrow(new LedgerGatewayException("Transaction submission failed (HTTP 400): tx_bad_seq"));

        mockMvc.perform(post("/api/submit-transaction")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "signedXDR": "AAAAsigned" }
                                """))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Transaction submission failed (HTTP 400): tx_bad_seq"));
    }

    @Test
    void unexpectedFailureFallsBackToExceptionName() throws Exception {
        when(transactionService.createKeypair()).thenThrow(new IllegalStateException());

        mockMvc.perform(get("/api/create-keypair"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("IllegalStateException"));
    }

    @Test
    void crossOriginPreflightIsAllowed() throws Exception {
        mockMvc.perform(options("/api/create-payment")
                        .header("Origin", "https://wallet.example")
                        .header("Access-Control-Request-Method", "POST"))
                .andExpect(status().isOk())
                .andExpect(header().exists("Access-Control-Allow-Origin"));
    }
}
