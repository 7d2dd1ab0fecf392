package com.carehub.billing.exception;

/**
 * Thrown for requests that are well-formed but not allowed in the current state,
 * e.g. editing a paid order or confirming a payment that is no longer pending.
 */
public class InvalidRequestException extends CareBillingException {

    public InvalidRequestException(String message) {
        super(ErrorCode.BAD_REQUEST, message);
    }

    protected InvalidRequestException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
