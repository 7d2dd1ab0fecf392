package com.carehub.billing.service;

import com.carehub.billing.dto.RemotePaymentRequest;
import com.carehub.billing.dto.RemotePaymentResponse;
import com.carehub.billing.exception.GatewayConfigurationException;
import com.carehub.billing.exception.GatewayUnavailableException;

import java.util.Map;

/**
 * Interface for communicating with the payment gateway.
 * <p>
 * Outbound requests and inbound webhooks are both authenticated with an
 * HMAC-SHA256 signature over the payload's sorted {@code key=value} pairs,
 * keyed by a secret shared with the gateway.
 */
public interface PaymentGatewayClient {

    /**
     * Signs a payload: keys sorted lexicographically, rendered as {@code key=value}
     * joined by {@code &}, HMAC-SHA256 with the shared secret, lowercase hex.
     * Null values are left out of the signing string.
     *
     * @throws GatewayConfigurationException if no secret is configured
     */
    String sign(Map<String, ?> payload);

    /**
     * Recomputes the signature of {@code payload} and compares it with the
     * provided one. Any mismatch, a missing signature or a missing secret is a
     * rejection.
     */
    boolean verifySignature(Map<String, ?> payload, String providedSignature);

    /**
     * Opens a checkout session at the gateway.
     *
     * @throws GatewayUnavailableException if the gateway cannot be reached or answers with a non-2xx status
     */
    RemotePaymentResponse createRemotePayment(RemotePaymentRequest request);

    /**
     * Returns the name of the gateway. Used for logging.
     */
    String getGatewayName();
}
