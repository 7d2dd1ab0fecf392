package com.carehub.billing.repository;

import com.carehub.billing.entity.PaymentStatus;
import com.carehub.billing.entity.PaymentTransaction;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository for payment transactions.
 * <p>
 * Status transitions are compare-and-set updates: each one only applies while
 * the row still holds the expected prior status and reports how many rows it
 * changed. A return value of 0 means another writer got there first.
 */
@Repository
public interface PaymentTransactionRepository extends JpaRepository<PaymentTransaction, Long> {

    /**
     * Look up the payment a gateway webhook refers to.
     */
    @EntityGraph(attributePaths = {"order"})
    Optional<PaymentTransaction> findByTransactionCode(String transactionCode);

    boolean existsByTransactionCode(String transactionCode);

    @EntityGraph(attributePaths = {"order"})
    List<PaymentTransaction> findByUserIdOrderByCreatedAtDesc(Long userId);

    Optional<PaymentTransaction> findFirstByOrderIdAndStatus(Long orderId, PaymentStatus status);

    /**
     * Move a payment between two statuses only if it is still in {@code expected}.
     *
     * @return number of rows changed, 0 or 1
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentTransaction p SET p.status = :newStatus, p.updatedAt = :now, " +
            "p.version = p.version + 1 WHERE p.id = :id AND p.status = :expected")
    int transitionStatus(
            @Param("id") Long id,
            @Param("expected") PaymentStatus expected,
            @Param("newStatus") PaymentStatus newStatus,
            @Param("now") LocalDateTime now
    );

    /**
     * Confirm a PENDING payment and store the gateway's view of it.
     *
     * @return number of rows changed, 0 if the payment was no longer PENDING
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentTransaction p SET p.status = com.carehub.billing.entity.PaymentStatus.SUCCESS, " +
            "p.paidAt = :paidAt, p.updatedAt = :paidAt, p.gatewayResponse = :gatewayResponse, " +
            "p.gatewayTransactionId = :gatewayTransactionId, " +
            "p.version = p.version + 1 " +
            "WHERE p.id = :id AND p.status = com.carehub.billing.entity.PaymentStatus.PENDING")
    int markPaid(
            @Param("id") Long id,
            @Param("paidAt") LocalDateTime paidAt,
            @Param("gatewayTransactionId") String gatewayTransactionId,
            @Param("gatewayResponse") String gatewayResponse
    );

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentTransaction p SET p.expiredAt = :expiredAt, p.updatedAt = :now " +
            "WHERE p.order.id = :orderId AND p.status = com.carehub.billing.entity.PaymentStatus.PENDING")
    int updatePendingExpiredAt(
            @Param("orderId") Long orderId,
            @Param("expiredAt") LocalDateTime expiredAt,
            @Param("now") LocalDateTime now
    );

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentTransaction p SET p.gatewayTransactionId = :gatewayTransactionId, " +
            "p.gatewayResponse = :gatewayResponse, p.updatedAt = :now WHERE p.id = :id")
    int attachGatewayCheckout(
            @Param("id") Long id,
            @Param("gatewayTransactionId") String gatewayTransactionId,
            @Param("gatewayResponse") String gatewayResponse,
            @Param("now") LocalDateTime now
    );

    long countByStatus(PaymentStatus status);

    /**
     * Payments created in {@code [from, to)}, for the dashboard.
     */
    @Query(value = "SELECT p FROM PaymentTransaction p WHERE p.createdAt >= :from AND p.createdAt < :to",
            countQuery = "SELECT COUNT(p) FROM PaymentTransaction p WHERE p.createdAt >= :from AND p.createdAt < :to")
    Page<PaymentTransaction> findCreatedBetween(
            @Param("from") LocalDateTime from,
            @Param("to") LocalDateTime to,
            Pageable pageable
    );

    @Query(value = "SELECT p FROM PaymentTransaction p WHERE p.status = :status " +
            "AND p.createdAt >= :from AND p.createdAt < :to",
            countQuery = "SELECT COUNT(p) FROM PaymentTransaction p WHERE p.status = :status " +
                    "AND p.createdAt >= :from AND p.createdAt < :to")
    Page<PaymentTransaction> findByStatusCreatedBetween(
            @Param("status") PaymentStatus status,
            @Param("from") LocalDateTime from,
            @Param("to") LocalDateTime to,
            Pageable pageable
    );

    /**
     * Successful payments paid in {@code [from, to)}, oldest first.
     */
    @Query("SELECT p FROM PaymentTransaction p WHERE p.status = com.carehub.billing.entity.PaymentStatus.SUCCESS " +
            "AND p.paidAt >= :from AND p.paidAt < :to ORDER BY p.paidAt ASC")
    List<PaymentTransaction> findPaidBetween(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);
}
