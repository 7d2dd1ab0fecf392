package com.carehub.billing.entity;

/**
 * Lifecycle buckets of a delayed job.
 */
public enum ScheduledJobStatus {
    /**
     * Enqueued, waiting for its run time.
     */
    WAITING,

    /**
     * Claimed by a poller and currently executing.
     */
    ACTIVE,

    COMPLETED,

    FAILED
}
