package com.carehub.billing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of payments. {@code page} is 1-based.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentPage {

    private List<PaymentView> items;
    private int page;
    private int limit;
    private long total;
    private int totalPages;
}
