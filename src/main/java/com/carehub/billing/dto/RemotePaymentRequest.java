package com.carehub.billing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemotePaymentRequest {

    private BigDecimal amount;
    private String transactionCode;
    private String description;
    private String returnUrl;
    private String cancelUrl;
}
