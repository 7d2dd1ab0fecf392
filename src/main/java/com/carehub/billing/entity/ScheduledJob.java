package com.carehub.billing.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A durable delayed job.
 * <p>
 * The job_key is derived from the payment id, so a payment never has more than
 * one row and scheduling the same payment twice does not create a second job.
 */
@Entity
@Table(name = "scheduled_jobs", indexes = {
        @Index(name = "idx_job_key", columnList = "job_key", unique = true),
        @Index(name = "idx_job_status_run_at", columnList = "status, run_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_key", nullable = false, unique = true, length = 100)
    private String jobKey;

    @Column(name = "job_name", nullable = false, length = 50)
    private String jobName;

    @Column(name = "payment_id", nullable = false)
    private Long paymentId;

    @Column(name = "run_at", nullable = false)
    private LocalDateTime runAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ScheduledJobStatus status;

    /**
     * When the current run claimed the job. An ACTIVE job whose claim is older
     * than the lease timeout is considered abandoned and is run again.
     */
    @Column(name = "claimed_at")
    private LocalDateTime claimedAt;

    @Column(name = "attempts")
    @Builder.Default
    private Integer attempts = 0;

    @Column(name = "last_error", length = 500)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
