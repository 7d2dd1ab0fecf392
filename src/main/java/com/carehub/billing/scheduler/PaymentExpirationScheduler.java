package com.carehub.billing.scheduler;

import com.carehub.billing.config.ExpirationProperties;
import com.carehub.billing.dto.ExpirationQueueStatus;
import com.carehub.billing.entity.ScheduledJob;
import com.carehub.billing.entity.ScheduledJobStatus;
import com.carehub.billing.repository.ScheduledJobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Durable delayed queue for payment expiration.
 * <p>
 * Each payment has at most one job, keyed {@code cancel-payment-<id>}. Jobs live
 * in the scheduled_jobs table so they survive restarts; a poller claims due jobs
 * with a conditional update and hands them to {@link PaymentExpirationWorker}.
 * A claim is a lease: a job left ACTIVE past {@code payment.expiration.lease-timeout}
 * goes back to WAITING and runs again. Delivery is therefore at-least-once, and
 * the worker's own status guard, not job removal, is what keeps a confirmed
 * payment from being expired.
 * <p>
 * Finished jobs are kept for {@code payment.expiration.finished-retention} so the
 * queue status can report them, then purged by the poller.
 */
@Component
@Slf4j
public class PaymentExpirationScheduler {

    public static final String CANCEL_PAYMENT_JOB_NAME = "cancel-payment";

    private static final int MAX_ERROR_LENGTH = 500;

    private final ScheduledJobRepository jobRepository;
    private final PaymentExpirationWorker worker;
    private final ExpirationProperties properties;

    public PaymentExpirationScheduler(ScheduledJobRepository jobRepository,
                                      PaymentExpirationWorker worker,
                                      ExpirationProperties properties) {
        this.jobRepository = jobRepository;
        this.worker = worker;
        this.properties = properties;
    }

    public static String jobKey(Long paymentId) {
        return CANCEL_PAYMENT_JOB_NAME + "-" + paymentId;
    }

    @Transactional
    @Retryable(
            retryFor = DataAccessException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 200, multiplier = 2)
    )
    public boolean scheduleCancellation(Long paymentId) {
        return scheduleCancellation(paymentId, properties.getTtl());
    }

    /**
     * Enqueues the expiration job for a payment to run no earlier than {@code after}
     * from now. Scheduling a payment whose job is still waiting or running is a no-op;
     * a finished job, or one whose claim has outlived its lease, is re-armed.
     *
     * @return true if a job was enqueued or re-armed
     */
    @Transactional
    @Retryable(
            retryFor = DataAccessException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 200, multiplier = 2)
    )
    public boolean scheduleCancellation(Long paymentId, Duration after) {
        String key = jobKey(paymentId);
        LocalDateTime runAt = LocalDateTime.now().plus(after);

        Optional<ScheduledJob> existing = jobRepository.findByJobKey(key);
        if (existing.isPresent()) {
            ScheduledJob job = existing.get();
            if (job.getStatus() == ScheduledJobStatus.WAITING
                    || (job.getStatus() == ScheduledJobStatus.ACTIVE && !isLeaseExpired(job))) {
                log.debug("Cancel payment job {} already {}, not scheduling again", key, job.getStatus());
                return false;
            }

            job.setStatus(ScheduledJobStatus.WAITING);
            job.setRunAt(runAt);
            job.setClaimedAt(null);
            job.setLastError(null);
            jobRepository.saveAndFlush(job);
            log.info("Re-armed cancel payment job {} for {}", key, runAt);
            return true;
        }

        jobRepository.saveAndFlush(ScheduledJob.builder()
                .jobKey(key)
                .jobName(CANCEL_PAYMENT_JOB_NAME)
                .paymentId(paymentId)
                .runAt(runAt)
                .status(ScheduledJobStatus.WAITING)
                .build());

        log.info("Added cancel payment job {} for payment {}, due at {}", key, paymentId, runAt);
        return true;
    }

    /**
     * Removes the waiting job of a payment. Removing a job that does not exist,
     * or that already started, is not an error.
     *
     * @return true if a waiting job was removed
     */
    @Transactional
    public boolean cancelScheduled(Long paymentId) {
        String key = jobKey(paymentId);
        int removed = jobRepository.deleteWaitingByJobKey(key);
        if (removed > 0) {
            log.info("Removed cancel payment job {}", key);
            return true;
        }
        log.debug("No waiting cancel payment job {} to remove", key);
        return false;
    }

    @Transactional(readOnly = true)
    public ExpirationQueueStatus getStatus() {
        return ExpirationQueueStatus.builder()
                .waiting(jobRepository.countByStatus(ScheduledJobStatus.WAITING))
                .active(jobRepository.countByStatus(ScheduledJobStatus.ACTIVE))
                .completed(jobRepository.countByStatus(ScheduledJobStatus.COMPLETED))
                .failed(jobRepository.countByStatus(ScheduledJobStatus.FAILED))
                .build();
    }

    /**
     * Drops every job that is not running: waiting jobs and finished ones.
     * Administrative use only: payments left PENDING lose their automatic expiry.
     *
     * @return number of jobs removed
     */
    @Transactional
    public int clearAll() {
        int removed = jobRepository.deleteAllNotActive();
        log.warn("Payment expiration queue cleared, {} jobs removed", removed);
        return removed;
    }

    /**
     * Polls for due jobs. Uses fixedDelay so that the next poll does not start
     * before the previous one has finished.
     */
    @Scheduled(fixedDelayString = "${payment.expiration.poll-interval-ms:30000}")
    public void pollDueJobs() {
        if (!properties.isPollerEnabled()) {
            return;
        }

        try {
            int processed = runDueJobs();
            if (processed > 0) {
                log.info("Expiration poll processed {} jobs", processed);
            }
        } catch (Exception e) {
            log.error("Expiration poll failed with unexpected error", e);
        }
    }

    /**
     * Recovers abandoned claims, purges old finished jobs and runs one batch of due jobs.
     *
     * @return number of jobs this poller claimed and ran
     */
    public int runDueJobs() {
        LocalDateTime now = LocalDateTime.now();

        int released = jobRepository.releaseStaleClaims(now.minus(properties.getLeaseTimeout()), now);
        if (released > 0) {
            log.warn("Returned {} abandoned cancel payment jobs to the queue", released);
        }
        int purged = jobRepository.deleteFinishedBefore(now.minus(properties.getFinishedRetention()));
        if (purged > 0) {
            log.debug("Purged {} finished cancel payment jobs", purged);
        }

        List<ScheduledJob> dueJobs = jobRepository.findDueJobs(now, PageRequest.of(0, properties.getBatchSize()));

        int processed = 0;
        for (ScheduledJob job : dueJobs) {
            if (jobRepository.claim(job.getId(), LocalDateTime.now()) == 0) {
                log.debug("Job {} was claimed by another poller", job.getJobKey());
                continue;
            }
            processed++;
            runJob(job);
        }
        return processed;
    }

    private void runJob(ScheduledJob job) {
        log.debug("Processing cancel payment job {}", job.getJobKey());
        try {
            ExpirationOutcome outcome = worker.expireIfDue(job.getPaymentId());
            jobRepository.finish(job.getId(), ScheduledJobStatus.COMPLETED, null, LocalDateTime.now());
            log.debug("Cancel payment job {} completed: {}", job.getJobKey(), outcome);
        } catch (Exception e) {
            log.error("Cancel payment job {} failed", job.getJobKey(), e);
            jobRepository.finish(job.getId(), ScheduledJobStatus.FAILED, truncate(e.getMessage()), LocalDateTime.now());
        }
    }

    private boolean isLeaseExpired(ScheduledJob job) {
        LocalDateTime claimedAt = job.getClaimedAt();
        return claimedAt == null || claimedAt.isBefore(LocalDateTime.now().minus(properties.getLeaseTimeout()));
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
