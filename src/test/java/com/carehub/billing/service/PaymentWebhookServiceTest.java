package com.carehub.billing.service;

import com.carehub.billing.dto.PaymentView;
import com.carehub.billing.dto.WebhookPayload;
import com.carehub.billing.entity.PaymentStatus;
import com.carehub.billing.exception.InvalidRequestException;
import com.carehub.billing.exception.SignatureVerificationException;
import com.carehub.billing.scheduler.PaymentExpirationScheduler;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentWebhookServiceTest {

    @Mock
    private PaymentGatewayClient gatewayClient;

    @Mock
    private PaymentService paymentService;

    @Mock
    private PaymentExpirationScheduler expirationScheduler;

    private SimpleMeterRegistry meterRegistry;
    private PaymentWebhookService webhookService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        webhookService = new PaymentWebhookService(
                gatewayClient, paymentService, expirationScheduler, new ObjectMapper(), meterRegistry);
        webhookService.initMetrics();
    }

    @Test
    @DisplayName("Should confirm the payment and remove its expiration job on SUCCESS")
    void shouldConfirmOnSuccess() {
        // Given
        WebhookPayload payload = payload(WebhookPayload.STATUS_SUCCESS);
        when(gatewayClient.verifySignature(payload.signedFields(), "sig")).thenReturn(true);
        when(paymentService.confirmPayment(eq("DH56789123"), eq(payload), contains("GW-1")))
                .thenReturn(PaymentView.builder().id(10L).status(PaymentStatus.SUCCESS).build());

        // When
        Optional<PaymentView> result = webhookService.handleWebhook(payload, "sig");

        // Then
        assertThat(result).isPresent();
        assertThat(result.get().getStatus()).isEqualTo(PaymentStatus.SUCCESS);
        verify(expirationScheduler).cancelScheduled(10L);
        assertThat(meterRegistry.counter("billing.payments.confirmed").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("billing.webhook.received").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject an invalid signature before touching any payment")
    void shouldRejectInvalidSignature() {
        WebhookPayload payload = payload(WebhookPayload.STATUS_SUCCESS);
        when(gatewayClient.verifySignature(anyMap(), eq("forged"))).thenReturn(false);

        assertThatThrownBy(() -> webhookService.handleWebhook(payload, "forged"))
                .isInstanceOf(SignatureVerificationException.class);
        verify(paymentService, never()).confirmPayment(anyString(), any(), any());
        assertThat(meterRegistry.counter("billing.webhook.rejected").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should fail with BadRequest when the signature is missing")
    void shouldRequireSignature() {
        assertThatThrownBy(() -> webhookService.handleWebhook(payload(WebhookPayload.STATUS_SUCCESS), " "))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("Missing signature");
    }

    @ParameterizedTest
    @ValueSource(strings = {WebhookPayload.STATUS_FAILED, WebhookPayload.STATUS_CANCELLED, "REFUNDED"})
    @DisplayName("Non-success statuses are accepted without a state change")
    void nonSuccessIsNoOp(String status) {
        WebhookPayload payload = payload(status);
        when(gatewayClient.verifySignature(anyMap(), eq("sig"))).thenReturn(true);

        Optional<PaymentView> result = webhookService.handleWebhook(payload, "sig");

        assertThat(result).isEmpty();
        verify(paymentService, never()).confirmPayment(anyString(), any(), any());
        verify(expirationScheduler, never()).cancelScheduled(anyLong());
    }

    @Test
    @DisplayName("A replayed SUCCESS propagates BadRequest and leaves the queue alone")
    void replayFails() {
        WebhookPayload payload = payload(WebhookPayload.STATUS_SUCCESS);
        when(gatewayClient.verifySignature(anyMap(), eq("sig"))).thenReturn(true);
        when(paymentService.confirmPayment(anyString(), any(), any()))
                .thenThrow(new InvalidRequestException("Payment 10 is not pending (status: SUCCESS)"));

        assertThatThrownBy(() -> webhookService.handleWebhook(payload, "sig"))
                .isInstanceOf(InvalidRequestException.class);
        verify(expirationScheduler, never()).cancelScheduled(anyLong());
        assertThat(meterRegistry.counter("billing.payments.confirmed").count()).isZero();
    }

    @Test
    @DisplayName("A queue failure after confirmation does not fail the webhook")
    void queueFailureIsTolerated() {
        WebhookPayload payload = payload(WebhookPayload.STATUS_SUCCESS);
        when(gatewayClient.verifySignature(anyMap(), eq("sig"))).thenReturn(true);
        when(paymentService.confirmPayment(anyString(), any(), any()))
                .thenReturn(PaymentView.builder().id(10L).status(PaymentStatus.SUCCESS).build());
        when(expirationScheduler.cancelScheduled(10L)).thenThrow(new IllegalStateException("queue down"));

        assertThat(webhookService.handleWebhook(payload, "sig")).isPresent();
    }

    private WebhookPayload payload(String status) {
        return WebhookPayload.builder()
                .transactionId("GW-1")
                .orderId("DH56789123")
                .amount(200000L)
                .status(status)
                .message("ok")
                .build();
    }
}
