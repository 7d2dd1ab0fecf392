package com.carehub.billing.service;

import com.carehub.billing.config.GatewayProperties;
import com.carehub.billing.config.ResilienceConfig;
import com.carehub.billing.dto.RemotePaymentRequest;
import com.carehub.billing.dto.RemotePaymentResponse;
import com.carehub.billing.exception.CareBillingException;
import com.carehub.billing.exception.GatewayConfigurationException;
import com.carehub.billing.exception.GatewayUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Sepay implementation of {@link PaymentGatewayClient}.
 * <p>
 * Checkout calls are protected by a circuit breaker and retried with
 * exponential backoff. Every transport failure reaches the caller as a
 * {@link GatewayUnavailableException}.
 */
@Service
@Slf4j
public class SepayGatewayClient implements PaymentGatewayClient {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String CREATE_PAYMENT_PATH = "/api/payment/create";

    private final GatewayProperties properties;
    private final RestTemplate restTemplate;

    public SepayGatewayClient(GatewayProperties properties, RestTemplate gatewayRestTemplate) {
        this.properties = properties;
        this.restTemplate = gatewayRestTemplate;
    }

    @Override
    public String sign(Map<String, ?> payload) {
        String secret = properties.getSecretKey();
        if (secret == null || secret.isBlank()) {
            throw new GatewayConfigurationException("Gateway secret key is not configured");
        }

        String signingString = new TreeMap<>(payload).entrySet().stream()
                .filter(entry -> entry.getValue() != null)
                .map(entry -> entry.getKey() + "=" + render(entry.getValue()))
                .collect(Collectors.joining("&"));

        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            byte[] digest = mac.doFinal(signingString.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new GatewayConfigurationException("Unable to initialise " + HMAC_ALGORITHM + ": " + e.getMessage());
        }
    }

    @Override
    public boolean verifySignature(Map<String, ?> payload, String providedSignature) {
        if (providedSignature == null || providedSignature.isEmpty()) {
            return false;
        }

        String expected;
        try {
            expected = sign(payload);
        } catch (GatewayConfigurationException e) {
            log.error("Rejecting webhook signature: {}", e.getMessage());
            return false;
        }

        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                providedSignature.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    @CircuitBreaker(name = ResilienceConfig.PAYMENT_GATEWAY, fallbackMethod = "createRemotePaymentFallback")
    @Retryable(
            retryFor = GatewayUnavailableException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2)
    )
    public RemotePaymentResponse createRemotePayment(RemotePaymentRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("amount", request.getAmount());
        payload.put("orderId", request.getTransactionCode());
        payload.put("description", request.getDescription());
        payload.put("returnUrl", request.getReturnUrl());
        payload.put("cancelUrl", request.getCancelUrl());
        payload.put("timestamp", System.currentTimeMillis());
        payload.put("signature", sign(payload));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(properties.getApiKey() == null ? "" : properties.getApiKey());

        log.debug("Creating {} checkout for reference {}", getGatewayName(), request.getTransactionCode());

        ResponseEntity<RemotePaymentResponse> response;
        try {
            response = restTemplate.postForEntity(
                    properties.getBaseUrl() + CREATE_PAYMENT_PATH,
                    new HttpEntity<>(payload, headers),
                    RemotePaymentResponse.class);
        } catch (RestClientResponseException e) {
            throw new GatewayUnavailableException(
                    String.format("%s rejected checkout with HTTP %d", getGatewayName(), e.getStatusCode().value()),
                    getGatewayName(),
                    request.getTransactionCode(),
                    e);
        } catch (RestClientException e) {
            throw new GatewayUnavailableException(
                    getGatewayName() + " is unreachable",
                    getGatewayName(),
                    request.getTransactionCode(),
                    e);
        }

        RemotePaymentResponse body = response.getBody();
        if (!response.getStatusCode().is2xxSuccessful() || body == null || body.getPaymentUrl() == null) {
            throw new GatewayUnavailableException(
                    getGatewayName() + " returned an empty checkout response",
                    getGatewayName(),
                    request.getTransactionCode());
        }

        log.info("{} checkout created for reference {}: gatewayTransactionId={}",
                getGatewayName(), request.getTransactionCode(), body.getGatewayTransactionId());
        return body;
    }

    /**
     * Fallback when the circuit breaker is open or the retries are exhausted.
     */
    public RemotePaymentResponse createRemotePaymentFallback(RemotePaymentRequest request, Throwable throwable) {
        if (throwable instanceof CareBillingException billingException
                && !(throwable instanceof GatewayUnavailableException)) {
            throw billingException;
        }

        log.warn("{} checkout unavailable for reference {}: {}",
                getGatewayName(), request.getTransactionCode(), throwable.getMessage());

        throw new GatewayUnavailableException(
                getGatewayName() + " is temporarily unavailable",
                getGatewayName(),
                request.getTransactionCode(),
                throwable);
    }

    @Override
    public String getGatewayName() {
        return properties.getName();
    }

    private static String render(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }
}
