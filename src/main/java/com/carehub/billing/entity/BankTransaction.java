package com.carehub.billing.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One movement on the receiving bank account, as reported by the gateway.
 * <p>
 * Every notification is recorded before it is matched, so the ledger also holds
 * transfers that did not pay any order. {@code paymentId} is set once a transfer
 * confirmed a payment.
 */
@Entity
@Table(name = "bank_transactions", indexes = {
        @Index(name = "idx_bank_tx_code", columnList = "code"),
        @Index(name = "idx_bank_tx_date", columnList = "transaction_date")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BankTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Id the gateway assigned to the transfer.
     */
    @Column(name = "gateway_reference_id")
    private Long gatewayReferenceId;

    @Column(nullable = false, length = 100)
    private String gateway;

    @Column(name = "transaction_date", nullable = false)
    private LocalDateTime transactionDate;

    @Column(name = "account_number", length = 100)
    private String accountNumber;

    @Column(name = "sub_account", length = 250)
    private String subAccount;

    @Column(name = "amount_in", nullable = false, precision = 19, scale = 2)
    @Builder.Default
    private BigDecimal amountIn = BigDecimal.ZERO;

    @Column(name = "amount_out", nullable = false, precision = 19, scale = 2)
    @Builder.Default
    private BigDecimal amountOut = BigDecimal.ZERO;

    @Column(precision = 19, scale = 2)
    private BigDecimal accumulated;

    @Column(length = 250)
    private String code;

    @Column(name = "transaction_content", length = 1000)
    private String transactionContent;

    @Column(name = "reference_number", length = 255)
    private String referenceNumber;

    @Column(length = 2000)
    private String body;

    @Column(name = "payment_id")
    private Long paymentId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
