package com.carehub.billing.exception;

/**
 * Base exception for billing errors that are reported to the caller.
 */
public class CareBillingException extends RuntimeException {

    private final ErrorCode errorCode;

    public CareBillingException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CareBillingException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
