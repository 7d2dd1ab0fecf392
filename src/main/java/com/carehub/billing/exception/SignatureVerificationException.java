package com.carehub.billing.exception;

/**
 * Thrown when a webhook signature does not match the payload.
 */
public class SignatureVerificationException extends CareBillingException {

    public SignatureVerificationException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
