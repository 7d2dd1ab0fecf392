package com.carehub.billing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "payment.expiration")
public class ExpirationProperties {

    /**
     * How long a payment may stay PENDING before it is expired.
     */
    private Duration ttl = Duration.ofHours(24);

    private long pollIntervalMs = 30_000;

    private int batchSize = 100;

    private boolean pollerEnabled = true;

    /**
     * How long a claimed job may stay ACTIVE before another poll returns it to WAITING.
     */
    private Duration leaseTimeout = Duration.ofMinutes(10);

    /**
     * How long COMPLETED and FAILED jobs are kept for the queue status before they are purged.
     */
    private Duration finishedRetention = Duration.ofHours(1);
}
