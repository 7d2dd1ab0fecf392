package com.carehub.billing.scheduler;

/**
 * What the expiration worker did for one payment.
 */
public enum ExpirationOutcome {
    /**
     * Payment moved from PENDING to EXPIRED.
     */
    EXPIRED,

    /**
     * Payment no longer exists.
     */
    PAYMENT_NOT_FOUND,

    /**
     * Payment already left PENDING (paid, cancelled, or expired by an earlier run),
     * including the case where a concurrent writer won the transition.
     */
    ALREADY_RESOLVED,

    /**
     * Fired before the payment's deadline.
     */
    NOT_YET_DUE
}
