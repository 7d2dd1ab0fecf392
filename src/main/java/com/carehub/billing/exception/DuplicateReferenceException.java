package com.carehub.billing.exception;

/**
 * Thrown when no unique order code or transfer reference could be allocated.
 */
public class DuplicateReferenceException extends CareBillingException {

    public DuplicateReferenceException(String message) {
        super(ErrorCode.CONFLICT, message);
    }
}
