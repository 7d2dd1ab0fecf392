package com.carehub.billing.service;

import com.carehub.billing.dto.PaymentView;
import com.carehub.billing.dto.WebhookPayload;
import com.carehub.billing.exception.InvalidRequestException;
import com.carehub.billing.exception.SignatureVerificationException;
import com.carehub.billing.scheduler.PaymentExpirationScheduler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Reconciles gateway webhooks against pending payments.
 * <p>
 * The HMAC signature is the only authorization for inbound calls. A replayed
 * SUCCESS notification fails with BadRequest because the payment is no longer
 * pending, so redelivery never credits twice.
 */
@Service
@Slf4j
public class PaymentWebhookService {

    private final PaymentGatewayClient gatewayClient;
    private final PaymentService paymentService;
    private final PaymentExpirationScheduler expirationScheduler;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    private Counter receivedCounter;
    private Counter rejectedCounter;
    private Counter confirmedCounter;

    public PaymentWebhookService(PaymentGatewayClient gatewayClient,
                                 PaymentService paymentService,
                                 PaymentExpirationScheduler expirationScheduler,
                                 ObjectMapper objectMapper,
                                 MeterRegistry meterRegistry) {
        this.gatewayClient = gatewayClient;
        this.paymentService = paymentService;
        this.expirationScheduler = expirationScheduler;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        receivedCounter = Counter.builder("billing.webhook.received")
                .description("Gateway webhooks received")
                .register(meterRegistry);

        rejectedCounter = Counter.builder("billing.webhook.rejected")
                .description("Gateway webhooks rejected for a bad signature")
                .register(meterRegistry);

        confirmedCounter = Counter.builder("billing.payments.confirmed")
                .description("Payments confirmed by webhook")
                .register(meterRegistry);
    }

    /**
     * Verifies and applies one webhook.
     *
     * @param payload   the notification body
     * @param signature the signature header; takes precedence over the body field
     * @return the confirmed payment for SUCCESS notifications, empty when the
     *         notification was accepted without a state change
     */
    public Optional<PaymentView> handleWebhook(WebhookPayload payload, String signature) {
        receivedCounter.increment();

        if (signature == null || signature.isBlank()) {
            throw new InvalidRequestException("Missing signature");
        }
        if (!gatewayClient.verifySignature(payload.signedFields(), signature)) {
            rejectedCounter.increment();
            log.warn("Rejected {} webhook for reference {}: invalid signature",
                    gatewayClient.getGatewayName(), payload.getOrderId());
            throw new SignatureVerificationException("Invalid webhook signature");
        }

        log.info("Webhook received: reference={}, status={}, transactionId={}",
                payload.getOrderId(), payload.getStatus(), payload.getTransactionId());

        String status = payload.getStatus() == null ? "" : payload.getStatus();
        switch (status) {
            case WebhookPayload.STATUS_SUCCESS:
                return Optional.of(handleSuccess(payload));
            case WebhookPayload.STATUS_FAILED:
            case WebhookPayload.STATUS_CANCELLED:
                // Gateway-side failure or cancellation leaves the payment PENDING; expiry still applies.
                log.info("Payment {} reported {} by gateway, no state change", payload.getOrderId(), status);
                return Optional.empty();
            default:
                log.warn("Ignoring webhook with unknown status '{}' for reference {}",
                        payload.getStatus(), payload.getOrderId());
                return Optional.empty();
        }
    }

    private PaymentView handleSuccess(WebhookPayload payload) {
        PaymentView confirmed = paymentService.confirmPayment(payload.getOrderId(), payload, toJson(payload));
        confirmedCounter.increment();

        try {
            expirationScheduler.cancelScheduled(confirmed.getId());
        } catch (RuntimeException e) {
            log.warn("Could not remove expiration job for confirmed payment {}: {}",
                    confirmed.getId(), e.getMessage());
        }
        return confirmed;
    }

    private String toJson(WebhookPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise webhook payload for reference {}: {}", payload.getOrderId(), e.getMessage());
            return null;
        }
    }
}
