package com.carehub.billing.exception;

/**
 * Thrown when communication with the payment gateway fails.
 * This could be due to network issues, timeouts, non-2xx answers or an open
 * circuit breaker. The underlying transport error is kept as the cause only.
 */
public class GatewayUnavailableException extends CareBillingException {

    private final String gatewayName;
    private final String reference;
    private final boolean isRetryable;

    public GatewayUnavailableException(String message, String gatewayName, String reference) {
        this(message, gatewayName, reference, true);
    }

    public GatewayUnavailableException(String message, String gatewayName, String reference,
                                       boolean isRetryable) {
        super(ErrorCode.GATEWAY_UNAVAILABLE, message);
        this.gatewayName = gatewayName;
        this.reference = reference;
        this.isRetryable = isRetryable;
    }

    public GatewayUnavailableException(String message, String gatewayName, String reference,
                                       Throwable cause) {
        super(ErrorCode.GATEWAY_UNAVAILABLE, message, cause);
        this.gatewayName = gatewayName;
        this.reference = reference;
        this.isRetryable = true;
    }

    public String getGatewayName() {
        return gatewayName;
    }

    public String getReference() {
        return reference;
    }

    /**
     * Indicates if this error is transient and the call can be retried.
     */
    public boolean isRetryable() {
        return isRetryable;
    }
}
