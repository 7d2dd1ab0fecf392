package com.carehub.billing.dto;

import com.carehub.billing.entity.PaymentStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Outcome of one bank transfer notification. Payment fields are empty when the
 * transfer was recorded without confirming a payment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BankTransferResult {

    private String message;
    private Long bankTransactionId;
    private Long paymentId;
    private Long orderId;
    private BigDecimal amount;
    private PaymentStatus status;
}
