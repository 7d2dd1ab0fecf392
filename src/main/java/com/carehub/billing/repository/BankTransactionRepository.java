package com.carehub.billing.repository;

import com.carehub.billing.entity.BankTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface BankTransactionRepository extends JpaRepository<BankTransaction, Long> {

    List<BankTransaction> findByCodeOrderByTransactionDateDesc(String code);

    /**
     * Record which payment a transfer confirmed.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE BankTransaction b SET b.paymentId = :paymentId WHERE b.id = :id")
    int linkPayment(@Param("id") Long id, @Param("paymentId") Long paymentId);
}
