package com.carehub.billing.entity;

/**
 * Represents the lifecycle status of a payment transaction.
 * <p>
 * Only PENDING may transition, and only to SUCCESS, CANCELLED or EXPIRED.
 * Every other status is terminal.
 */
public enum PaymentStatus {
    /**
     * Waiting for the patient's transfer. The only non-terminal status.
     */
    PENDING,

    /**
     * Confirmed by a signed gateway webhook.
     */
    SUCCESS,

    /**
     * Cancelled explicitly before it was paid.
     */
    CANCELLED,

    /**
     * Closed by the expiration worker after the payment window elapsed.
     */
    EXPIRED,

    /**
     * Rejected by the gateway.
     */
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
