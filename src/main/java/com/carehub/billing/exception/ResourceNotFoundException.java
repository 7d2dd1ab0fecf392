package com.carehub.billing.exception;

/**
 * Thrown when a user, order, payment, appointment or treatment does not exist.
 */
public class ResourceNotFoundException extends CareBillingException {

    public ResourceNotFoundException(String resource, Object identifier) {
        super(ErrorCode.NOT_FOUND, String.format("%s %s not found", resource, identifier));
    }
}
