package com.carehub.billing.exception;

/**
 * Thrown when a referenced record exists but belongs to another user.
 */
public class OwnershipMismatchException extends CareBillingException {

    public OwnershipMismatchException(String resource, Object identifier, Long userId) {
        super(ErrorCode.FORBIDDEN,
                String.format("%s %s does not belong to user %d", resource, identifier, userId));
    }
}
