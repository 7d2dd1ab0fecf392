package com.carehub.billing.exception;

/**
 * Thrown when a gateway callback does not carry the configured API key.
 */
public class InvalidApiKeyException extends CareBillingException {

    public InvalidApiKeyException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
