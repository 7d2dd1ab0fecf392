package com.carehub.billing.exception;

/**
 * Thrown when a transfer reference or one of its parts is malformed.
 */
public class InvalidTransferContentException extends InvalidRequestException {

    public InvalidTransferContentException(String message) {
        super(ErrorCode.INVALID_FORMAT, message);
    }
}
