package com.carehub.billing.entity;

/**
 * Represents the lifecycle status of an order.
 */
public enum OrderStatus {
    /**
     * Order created, waiting for its payment to be confirmed.
     */
    PENDING,

    /**
     * Payment confirmed. Paid orders can no longer be edited.
     */
    PAID,

    /**
     * Cancelled before payment.
     */
    CANCELLED,

    /**
     * Payment window closed without a confirmed transfer.
     */
    EXPIRED
}
