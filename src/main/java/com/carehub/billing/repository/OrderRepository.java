package com.carehub.billing.repository;

import com.carehub.billing.entity.Order;
import com.carehub.billing.entity.OrderStatus;
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
 * Repository for orders. Finders load the to-one summaries eagerly so that
 * every read produces the same hydrated shape.
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, Long> {

    @EntityGraph(attributePaths = {"user", "appointment", "appointment.service", "patientTreatment"})
    Optional<Order> findWithDetailsById(Long id);

    @EntityGraph(attributePaths = {"user", "appointment", "appointment.service", "patientTreatment"})
    Optional<Order> findWithDetailsByOrderCode(String orderCode);

    @EntityGraph(attributePaths = {"user", "appointment", "appointment.service", "patientTreatment"})
    List<Order> findByUserIdOrderByCreatedAtDescIdDesc(Long userId);

    boolean existsByOrderCode(String orderCode);

    /**
     * Move an order between two statuses only if it is still in {@code expected}.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.orderStatus = :newStatus, o.updatedAt = :now " +
            "WHERE o.id = :id AND o.orderStatus = :expected")
    int transitionStatus(
            @Param("id") Long id,
            @Param("expected") OrderStatus expected,
            @Param("newStatus") OrderStatus newStatus,
            @Param("now") LocalDateTime now
    );
}
