package com.carehub.billing.repository;

import com.carehub.billing.entity.ScheduledJob;
import com.carehub.billing.entity.ScheduledJobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, Long> {

    Optional<ScheduledJob> findByJobKey(String jobKey);

    /**
     * Jobs whose run time has passed, oldest first.
     */
    @Query("SELECT j FROM ScheduledJob j WHERE j.status = com.carehub.billing.entity.ScheduledJobStatus.WAITING " +
            "AND j.runAt <= :now ORDER BY j.runAt ASC")
    List<ScheduledJob> findDueJobs(@Param("now") LocalDateTime now, Pageable pageable);

    /**
     * Claim a waiting job for execution. Only one poller can win the claim.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ScheduledJob j SET j.status = com.carehub.billing.entity.ScheduledJobStatus.ACTIVE, " +
            "j.claimedAt = :now, j.attempts = j.attempts + 1, j.updatedAt = :now, j.version = j.version + 1 " +
            "WHERE j.id = :id AND j.status = com.carehub.billing.entity.ScheduledJobStatus.WAITING")
    int claim(@Param("id") Long id, @Param("now") LocalDateTime now);

    /**
     * Return ACTIVE jobs claimed before {@code cutoff} to WAITING. Their poller
     * died or lost its connection before recording the outcome.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ScheduledJob j SET j.status = com.carehub.billing.entity.ScheduledJobStatus.WAITING, " +
            "j.claimedAt = null, j.updatedAt = :now, j.version = j.version + 1 " +
            "WHERE j.status = com.carehub.billing.entity.ScheduledJobStatus.ACTIVE " +
            "AND (j.claimedAt IS NULL OR j.claimedAt < :cutoff)")
    int releaseStaleClaims(@Param("cutoff") LocalDateTime cutoff, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ScheduledJob j SET j.status = :status, j.lastError = :lastError, j.updatedAt = :now, " +
            "j.version = j.version + 1 WHERE j.id = :id")
    int finish(
            @Param("id") Long id,
            @Param("status") ScheduledJobStatus status,
            @Param("lastError") String lastError,
            @Param("now") LocalDateTime now
    );

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ScheduledJob j WHERE j.jobKey = :jobKey " +
            "AND j.status = com.carehub.billing.entity.ScheduledJobStatus.WAITING")
    int deleteWaitingByJobKey(@Param("jobKey") String jobKey);

    /**
     * Delete COMPLETED and FAILED jobs last touched before {@code cutoff}.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ScheduledJob j WHERE j.status IN (com.carehub.billing.entity.ScheduledJobStatus.COMPLETED, " +
            "com.carehub.billing.entity.ScheduledJobStatus.FAILED) AND j.updatedAt < :cutoff")
    int deleteFinishedBefore(@Param("cutoff") LocalDateTime cutoff);

    /**
     * Delete every job that is not currently running.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ScheduledJob j WHERE j.status <> com.carehub.billing.entity.ScheduledJobStatus.ACTIVE")
    int deleteAllNotActive();

    long countByStatus(ScheduledJobStatus status);
}
